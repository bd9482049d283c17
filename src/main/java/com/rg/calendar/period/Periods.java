package com.rg.calendar.period;

/**
 * Static entry points for parsing ISO-8601 periods.
 *
 * Accepted syntax: an optional '+' or '-', then 'P', then any of the date fields
 * {@code nY nM nW nD}, then optionally 'T' followed by any of {@code nH nM nS}.
 * Only seconds may have a fraction, written with '.' or ','; one fraction digit is
 * kept (truncated). "P0" is accepted as the zero period.
 *
 * By default the result is normalized: "P24M" is the same as "P2Y". Days never
 * contribute to months, since the number of days per month varies.
 */
public final class Periods {
  private static final PeriodParser NORMALIZING = PeriodParserBuilder.builder().build();
  private static final PeriodParser RAW = PeriodParserBuilder.builder().normalize(false).build();

  private Periods() {}

  /** Parses and normalizes. */
  public static ParseResult parse(String text) {
    return NORMALIZING.parse(text);
  }

  public static ParseResult parse(String text, boolean normalize) {
    return parser(normalize).parse(text);
  }

  /** Same as {@link #parse(String, boolean)}; the normalize flag has no default here. */
  public static ParseResult parseStrict(String text, boolean normalize) {
    return parser(normalize).parse(text);
  }

  /**
   * Parses and normalizes, throwing on failure. For constants in code only.
   *
   * @throws PeriodParseException if the text is not a valid period
   */
  public static Period parseOrThrow(String text) {
    return NORMALIZING.parseOrThrow(text);
  }

  /** @throws PeriodParseException if the text is not a valid period */
  public static Period parseOrThrow(String text, boolean normalize) {
    return parser(normalize).parseOrThrow(text);
  }

  private static PeriodParser parser(boolean normalize) {
    return normalize ? NORMALIZING : RAW;
  }
}
