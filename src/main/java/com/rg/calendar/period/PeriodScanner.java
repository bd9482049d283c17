package com.rg.calendar.period;

import com.rg.calendar.period.PeriodParseError.Kind;

import java.util.Objects;

/**
 * Splits an ISO-8601 period string into its fields.
 *
 * Rules:
 * - optional leading '+' or '-', then the mandatory 'P'
 * - everything after the first 'T' is the time part (H, M, S), the rest is the date part (Y, M, W, D)
 * - within each part the markers are looked up in that fixed order, each one optional
 * - a marker needs at least one digit in front of it
 * - nothing may be left over once a part's markers are consumed
 * - at least one field must be present; "P0" is the only accepted spelling without a marker
 *
 * Weeks are folded into days here ({@code days += weeks * 7}).
 */
final class PeriodScanner {
  static final String ZERO_LITERAL = "P0";

  private PeriodScanner() {}

  /** Remaining text of the part being scanned, and whether any field matched so far. */
  private record ScanState(String input, String remaining, boolean matched) {

    ScanState advance(String rest) {
      return new ScanState(input, rest, true);
    }

    ScanState switchTo(String part) {
      return new ScanState(input, part, matched);
    }
  }

  private record Field(long value, ScanState state) {}

  static RawPeriod scan(String text) {
    Objects.requireNonNull(text, "text");

    if (text.isEmpty() || text.equals("-") || text.equals("+")) {
      throw failure(Kind.EMPTY_OR_SIGN_ONLY_INPUT, text, null, null);
    }
    if (text.equals(ZERO_LITERAL)) {
      return RawPeriod.zero(text);
    }

    boolean negative = false;
    int start = 0;
    if (text.charAt(0) == '-') {
      negative = true;
      start = 1;
    } else if (text.charAt(0) == '+') {
      start = 1;
    }

    if (text.charAt(start) != 'P') {
      throw failure(Kind.MISSING_PERIOD_MARKER, text, null, null);
    }
    String body = text.substring(start + 1);

    int t = body.indexOf('T');
    String datePart = t >= 0 ? body.substring(0, t) : body;
    ScanState st = new ScanState(text, "", false);

    long hours = 0;
    long minutes = 0;
    long seconds = 0;
    if (t >= 0) {
      st = st.switchTo(body.substring(t + 1));

      Field f = extract(st, Designator.HOURS);
      hours = f.value();
      f = extract(f.state(), Designator.MINUTES);
      minutes = f.value();
      f = extract(f.state(), Designator.SECONDS);
      seconds = f.value();
      st = f.state();

      requireConsumed(st);
    }

    st = st.switchTo(datePart);
    Field f = extract(st, Designator.YEARS);
    long years = f.value();
    f = extract(f.state(), Designator.MONTHS);
    long months = f.value();
    f = extract(f.state(), Designator.WEEKS);
    long weeks = f.value();
    f = extract(f.state(), Designator.DAYS);
    long days = f.value();
    st = f.state();

    requireConsumed(st);

    if (!st.matched()) {
      throw failure(Kind.NO_FIELDS_MATCHED, text, null, null);
    }

    // both are at most Long.MAX_VALUE / 1000 in magnitude, so this cannot overflow
    return new RawPeriod(years, months, weeks * 7 + days, hours, minutes, seconds, negative, text);
  }

  private static Field extract(ScanState st, Designator designator) {
    String remaining = st.remaining();
    int m = remaining.indexOf(designator.marker());
    if (m < 0) {
      return new Field(0, st);
    }
    if (m == 0) {
      throw failure(Kind.MISSING_FIELD_NUMBER, st.input(), designator, null);
    }

    long value = toValue(remaining.substring(0, m), designator, st.input());
    return new Field(value, st.advance(remaining.substring(m + 1)));
  }

  private static long toValue(String number, Designator designator, String input) {
    long fixed;
    try {
      fixed = FixedPointDecimal.parse(number);
    } catch (NumberFormatException e) {
      throw failure(Kind.MALFORMED_FIELD_NUMBER, input, designator, e.getMessage(), e);
    }

    if (designator.fractional()) {
      return fixed;
    }
    if (hasNonZeroFraction(number)) {
      throw failure(Kind.MALFORMED_FIELD_NUMBER, input, designator, "fraction is only allowed on seconds");
    }
    return fixed / FixedPointDecimal.SCALE;
  }

  private static boolean hasNonZeroFraction(String number) {
    int dec = Math.max(number.indexOf('.'), number.indexOf(','));
    if (dec < 0) return false;
    for (int i = dec + 1; i < number.length(); i++) {
      if (number.charAt(i) != '0') return true;
    }
    return false;
  }

  private static void requireConsumed(ScanState st) {
    if (!st.remaining().isEmpty()) {
      throw failure(Kind.TRAILING_UNCONSUMED_TEXT, st.input(), null, st.remaining());
    }
  }

  private static PeriodParseException failure(Kind kind, String input, Designator designator, String detail) {
    return failure(kind, input, designator, detail, null);
  }

  private static PeriodParseException failure(
      Kind kind, String input, Designator designator, String detail, Throwable cause) {
    Character marker = designator == null ? null : designator.marker();
    return new PeriodParseException(new PeriodParseError(kind, input, marker, detail), cause);
  }
}
