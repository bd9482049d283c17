package com.rg.calendar.period;

/**
 * Scanner output before normalization.
 *
 * Magnitudes are stored exactly as written; the overall sign lives only in
 * {@code negative} and is applied once, by {@link #toPeriod()}.
 * {@code seconds} is fixed-point thousandths. {@code originalText} is kept for
 * diagnostics only.
 */
record RawPeriod(
    long years,
    long months,
    long days,
    long hours,
    long minutes,
    long seconds,
    boolean negative,
    String originalText
) {

  static RawPeriod zero(String originalText) {
    return new RawPeriod(0, 0, 0, 0, 0, 0, false, originalText);
  }

  RawPeriod withYearsAndMonths(long years, long months) {
    return new RawPeriod(years, months, days, hours, minutes, seconds, negative, originalText);
  }

  Period toPeriod() {
    if (!negative) {
      return new Period(years, months, days, hours, minutes, seconds);
    }
    return new Period(
        Math.negateExact(years),
        Math.negateExact(months),
        Math.negateExact(days),
        Math.negateExact(hours),
        Math.negateExact(minutes),
        Math.negateExact(seconds)
    );
  }
}
