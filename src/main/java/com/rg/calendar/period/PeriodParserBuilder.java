package com.rg.calendar.period;

/**
 * Fluent builder for PeriodParser.
 *
 * Defaults:
 * - normalize = true
 */
public final class PeriodParserBuilder {

  private boolean normalize = true;

  private PeriodParserBuilder() {}

  /** Start a new builder (normalization on). */
  public static PeriodParserBuilder builder() {
    return new PeriodParserBuilder();
  }

  /** Fold whole multiples of 12 months into years, e.g. "P24M" parses as "P2Y". */
  public PeriodParserBuilder normalize(boolean normalize) {
    this.normalize = normalize;
    return this;
  }

  public PeriodParser build() {
    return new PeriodParser(normalize);
  }
}
