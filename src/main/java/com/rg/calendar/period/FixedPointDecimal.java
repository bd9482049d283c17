package com.rg.calendar.period;

/**
 * Fixed-point decimal text with three implied decimal places ("1.5" -> 1500).
 *
 * Rules:
 * - '.' or ',' separates the fraction; at most one separator
 * - only the first fraction digit is kept, the rest are truncated (never rounded)
 * - a number without a fraction is simply scaled by 1000
 *
 * The parser knows nothing about units: deciding which fields may carry a
 * fraction is up to the caller.
 */
final class FixedPointDecimal {
  static final long SCALE = 1000;

  private FixedPointDecimal() {}

  /**
   * @throws NumberFormatException if the text is not an optional sign followed by ASCII
   *     digits (and an ASCII digit fraction), or the scaled value does not fit in a
   *     signed 64-bit integer
   */
  static long parse(String text) {
    int dec = text.indexOf('.');
    if (dec < 0) dec = text.indexOf(',');

    String whole = dec < 0 ? text : text.substring(0, dec);
    String fraction = dec < 0 ? "" : text.substring(dec + 1);

    int start = !whole.isEmpty() && (whole.charAt(0) == '+' || whole.charAt(0) == '-') ? 1 : 0;
    if (!allAsciiDigits(whole, start) || !allAsciiDigits(fraction, 0)) {
      throw malformed(text);
    }
    if (whole.length() == start && fraction.isEmpty()) {
      throw malformed(text);
    }

    if (dec < 0) {
      return Long.parseLong(whole + "000");
    }
    char tenths = fraction.isEmpty() ? '0' : fraction.charAt(0);
    return Long.parseLong(whole + tenths + "00");
  }

  private static boolean allAsciiDigits(String s, int from) {
    for (int i = from; i < s.length(); i++) {
      if (!isAsciiDigit(s.charAt(i))) return false;
    }
    return true;
  }

  private static NumberFormatException malformed(String text) {
    return new NumberFormatException("For input string: \"" + text + "\"");
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
