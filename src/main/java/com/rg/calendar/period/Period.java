package com.rg.calendar.period;

import java.time.Duration;

/**
 * An ISO-8601 period such as {@code P1Y2M3DT4H5M6.7S}.
 *
 * Every component is signed. {@code seconds} is fixed-point: thousandths of a
 * second, so {@code PT1.5S} has {@code seconds == 1500}. Weeks are not a
 * separate component; they are held as days.
 *
 * Equality is on the component set, so all spellings of the zero period
 * ("P0D", "PT0S", "P0", ...) are equal to {@link #ZERO}.
 */
public record Period(
    long years,
    long months,
    long days,
    long hours,
    long minutes,
    long seconds
) {
  public static final Period ZERO = new Period(0, 0, 0, 0, 0, 0);

  private static final long MILLIS_PER_SECOND = FixedPointDecimal.SCALE;

  public static Period ofYears(long years) {
    return new Period(years, 0, 0, 0, 0, 0);
  }

  public static Period ofMonths(long months) {
    return new Period(0, months, 0, 0, 0, 0);
  }

  public static Period ofWeeks(long weeks) {
    return new Period(0, 0, Math.multiplyExact(weeks, 7), 0, 0, 0);
  }

  public static Period ofDays(long days) {
    return new Period(0, 0, days, 0, 0, 0);
  }

  public static Period ofHours(long hours) {
    return new Period(0, 0, 0, hours, 0, 0);
  }

  public static Period ofMinutes(long minutes) {
    return new Period(0, 0, 0, 0, minutes, 0);
  }

  public static Period ofSeconds(long seconds) {
    return new Period(0, 0, 0, 0, 0, Math.multiplyExact(seconds, MILLIS_PER_SECOND));
  }

  public static Period ofMillis(long millis) {
    return new Period(0, 0, 0, 0, 0, millis);
  }

  /** Date components only. */
  public static Period of(long years, long months, long days) {
    return new Period(years, months, days, 0, 0, 0);
  }

  /** Parses with normalization. See {@link Periods#parseOrThrow(String)}. */
  public static Period parse(String text) {
    return Periods.parseOrThrow(text);
  }

  public boolean isZero() {
    return years == 0 && months == 0 && days == 0 && hours == 0 && minutes == 0 && seconds == 0;
  }

  /** True if any component is negative. */
  public boolean isNegative() {
    return years < 0 || months < 0 || days < 0 || hours < 0 || minutes < 0 || seconds < 0;
  }

  /** True if no component is negative and at least one is positive. */
  public boolean isPositive() {
    return !isZero() && !isNegative();
  }

  public Period negate() {
    return new Period(
        Math.negateExact(years),
        Math.negateExact(months),
        Math.negateExact(days),
        Math.negateExact(hours),
        Math.negateExact(minutes),
        Math.negateExact(seconds)
    );
  }

  public Period abs() {
    return new Period(
        Math.absExact(years),
        Math.absExact(months),
        Math.absExact(days),
        Math.absExact(hours),
        Math.absExact(minutes),
        Math.absExact(seconds)
    );
  }

  /**
   * Folds whole multiples of 12 months into years. No other component is touched.
   *
   * @throws ArithmeticException if years overflow
   */
  public Period normalize() {
    return PeriodNormalizer.normalize(this);
  }

  /** Whole seconds, truncated toward zero. */
  public long wholeSeconds() {
    return seconds / MILLIS_PER_SECOND;
  }

  /** Millisecond part of {@link #seconds()}, with the same sign. */
  public long millisOfSecond() {
    return seconds % MILLIS_PER_SECOND;
  }

  /**
   * Years, months and days as a {@link java.time.Period}. Time components are not represented.
   *
   * @throws ArithmeticException if a component does not fit in an int
   */
  public java.time.Period toJavaPeriod() {
    return java.time.Period.of(Math.toIntExact(years), Math.toIntExact(months), Math.toIntExact(days));
  }

  /**
   * Days, hours, minutes and seconds as a fixed {@link Duration}, counting a day as 24 hours.
   *
   * @throws IllegalStateException if years or months are non-zero (they have no fixed length)
   * @throws ArithmeticException if the total overflows
   */
  public Duration toDuration() {
    if (years != 0 || months != 0) {
      throw new IllegalStateException("years and months have no fixed duration: " + this);
    }
    return Duration.ofDays(days)
        .plusHours(hours)
        .plusMinutes(minutes)
        .plusMillis(seconds);
  }

  /** ISO-8601 text; the zero period is "P0D". */
  @Override
  public String toString() {
    return PeriodFormatter.format(this);
  }
}
