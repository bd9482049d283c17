package com.rg.calendar.period;

/**
 * Canonicalizes the years/months axis: whole multiples of 12 months become years.
 *
 * This is the only carry performed. Days, hours, minutes and seconds are never
 * moved into or out of months or years, because a day is not a fixed fraction
 * of a month under any calendar.
 */
final class PeriodNormalizer {
  private static final long MONTHS_PER_YEAR = 12;

  private PeriodNormalizer() {}

  /** Years and months after reduction; {@code months} carries the sign of the total. */
  record YearsMonths(long years, long months) {}

  static RawPeriod normalize(RawPeriod raw) {
    YearsMonths ym = reduce(raw.years(), raw.months());
    return raw.withYearsAndMonths(ym.years(), ym.months());
  }

  static Period normalize(Period period) {
    YearsMonths ym = reduce(period.years(), period.months());
    return new Period(ym.years(), ym.months(), period.days(), period.hours(), period.minutes(), period.seconds());
  }

  /**
   * Equivalent to {@code total = years * 12 + months; years = total / 12; months = total % 12},
   * computed without forming {@code years * 12}.
   *
   * @throws ArithmeticException if the resulting years do not fit in a long
   */
  static YearsMonths reduce(long years, long months) {
    long y = Math.addExact(years, months / MONTHS_PER_YEAR);
    long m = months % MONTHS_PER_YEAR;

    if (y > 0 && m < 0) {
      y--;
      m += MONTHS_PER_YEAR;
    } else if (y < 0 && m > 0) {
      y++;
      m -= MONTHS_PER_YEAR;
    }
    return new YearsMonths(y, m);
  }
}
