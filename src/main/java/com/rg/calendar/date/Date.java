package com.rg.calendar.date;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;

/**
 * A date in the proleptic Gregorian calendar used by ISO-8601, held as the
 * number of days since 1970-01-01. Year 0 exists (1 BC) and earlier years are negative.
 *
 * The zero value is 1970-01-01; {@link #isZero()} detects it.
 */
public record Date(long epochDay) implements Comparable<Date> {
  public static final Date MIN = new Date(LocalDate.MIN.toEpochDay());
  public static final Date MAX = new Date(LocalDate.MAX.toEpochDay());

  public Date {
    ChronoField.EPOCH_DAY.checkValidValue(epochDay);
  }

  /**
   * The date for the given year, month and day. Month and day outside their usual
   * ranges roll over: month 13 is January of the next year, day 0 is the last day
   * of the previous month.
   *
   * Years are not wrapped: the result must lie within {@link #MIN} and {@link #MAX}.
   *
   * @throws java.time.DateTimeException if the year, or the date after rolling over,
   *     is outside the range supported by {@link LocalDate}
   */
  public static Date of(int year, int month, int day) {
    LocalDate d = LocalDate.of(year, Month.JANUARY, 1)
        .plusMonths(month - 1L)
        .plusDays(day - 1L);
    return new Date(d.toEpochDay());
  }

  public static Date from(LocalDate date) {
    return new Date(date.toEpochDay());
  }

  public static Date ofEpochDay(long epochDay) {
    return new Date(epochDay);
  }

  public LocalDate toLocalDate() {
    return LocalDate.ofEpochDay(epochDay);
  }

  public int year() {
    return toLocalDate().getYear();
  }

  public Month month() {
    return toLocalDate().getMonth();
  }

  /** Day of month, starting at 1. */
  public int day() {
    return toLocalDate().getDayOfMonth();
  }

  /** 1..365, or 1..366 in leap years. */
  public int dayOfYear() {
    return toLocalDate().getDayOfYear();
  }

  public DayOfWeek dayOfWeek() {
    return toLocalDate().getDayOfWeek();
  }

  /**
   * ISO-8601 week-based year and week (1..53). Jan 1-3 may belong to the last week
   * of the previous year, Dec 29-31 to week 1 of the next.
   */
  public IsoWeek isoWeek() {
    LocalDate d = toLocalDate();
    return new IsoWeek(d.get(IsoFields.WEEK_BASED_YEAR), d.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
  }

  public boolean isZero() {
    return epochDay == 0;
  }

  public boolean isBefore(Date other) {
    return epochDay < other.epochDay;
  }

  public boolean isAfter(Date other) {
    return epochDay > other.epochDay;
  }

  /** The parameter may be negative. */
  public Date plusDays(long days) {
    return new Date(Math.addExact(epochDay, days));
  }

  /**
   * Adds years, months and days field by field, then rolls over as {@link #of} does:
   * adding one month to January 31 gives March 2 or 3, not February 28.
   *
   * @throws java.time.DateTimeException if the result is outside {@link #MIN} and {@link #MAX}
   */
  public Date plusDate(int years, int months, int days) {
    LocalDate d = toLocalDate();
    return of(
        Math.addExact(d.getYear(), years),
        Math.addExact(d.getMonthValue(), months),
        Math.addExact(d.getDayOfMonth(), days)
    );
  }

  /** Number of days from {@code other} to this date ({@code this - other}). */
  public long minus(Date other) {
    return Math.subtractExact(epochDay, other.epochDay);
  }

  @Override
  public int compareTo(Date other) {
    return Long.compare(epochDay, other.epochDay);
  }

  /** ISO-8601 form, e.g. 2024-02-29. */
  @Override
  public String toString() {
    return toLocalDate().toString();
  }
}
