package com.rg.calendar.period;

import java.util.Locale;

/**
 * Writes a {@link Period} as ISO-8601 text.
 *
 * Rules:
 * - zero is "P0D"
 * - when no component is positive the sign is written once, in front: "-P1Y2M"
 * - with mixed signs each negative component keeps its own sign: "P1Y-2M"
 * - days are never folded back into weeks
 * - seconds use as few fraction digits as needed: "PT1.5S"
 */
public final class PeriodFormatter {
  private PeriodFormatter() {}

  public static String format(Period period) {
    if (period.isZero()) return "P0D";

    boolean leadingMinus = period.isNegative() && !hasPositive(period);
    Period shown = leadingMinus ? period.negate() : period;

    StringBuilder sb = new StringBuilder(24);
    if (leadingMinus) sb.append('-');
    sb.append('P');
    appendField(sb, shown.years(), 'Y');
    appendField(sb, shown.months(), 'M');
    appendField(sb, shown.days(), 'D');

    if (shown.hours() != 0 || shown.minutes() != 0 || shown.seconds() != 0) {
      sb.append('T');
      appendField(sb, shown.hours(), 'H');
      appendField(sb, shown.minutes(), 'M');
      appendSeconds(sb, shown.seconds());
    }
    return sb.toString();
  }

  private static boolean hasPositive(Period p) {
    return p.years() > 0 || p.months() > 0 || p.days() > 0
        || p.hours() > 0 || p.minutes() > 0 || p.seconds() > 0;
  }

  private static void appendField(StringBuilder sb, long value, char marker) {
    if (value != 0) sb.append(value).append(marker);
  }

  private static void appendSeconds(StringBuilder sb, long fixed) {
    if (fixed == 0) return;

    long scale = FixedPointDecimal.SCALE;
    long whole = fixed / scale;
    long fraction = Math.abs(fixed % scale);

    if (fixed < 0) sb.append('-');
    sb.append(Math.abs(whole));
    if (fraction != 0) {
      String digits = String.format(Locale.ROOT, "%03d", fraction);
      int end = digits.length();
      while (digits.charAt(end - 1) == '0') end--;
      sb.append('.').append(digits, 0, end);
    }
    sb.append('S');
  }
}
