package com.rg.calendar.period;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configured ISO-8601 period parser. Immutable and safe to share between threads:
 * all parse state is local to each call.
 *
 * Create one with {@link PeriodParserBuilder}; {@link Periods} holds ready-made instances.
 */
public final class PeriodParser {
  private static final Logger logger = LoggerFactory.getLogger(PeriodParser.class);

  private final boolean normalize;

  PeriodParser(boolean normalize) {
    this.normalize = normalize;
  }

  public static PeriodParserBuilder builder() {
    return PeriodParserBuilder.builder();
  }

  /** Whether parsed periods have whole multiples of 12 months folded into years. */
  public boolean normalize() {
    return normalize;
  }

  /**
   * Parses {@code text} exactly as given (no trimming, no case folding).
   * Never returns a partial result alongside an error.
   */
  public ParseResult parse(String text) {
    try {
      return new ParseResult.Parsed(parseOrThrow(text));
    } catch (PeriodParseException e) {
      logger.debug("Rejected period: kind={}, input={}", e.kind(), text);
      return new ParseResult.Failed(e.error());
    }
  }

  /**
   * As {@link #parse(String)} but throws on failure. Meant for literals known when
   * the code is written; do not use it on untrusted input.
   *
   * @throws PeriodParseException if the text is not a valid period
   */
  public Period parseOrThrow(String text) {
    RawPeriod raw = PeriodScanner.scan(text);
    Period period = (normalize ? PeriodNormalizer.normalize(raw) : raw).toPeriod();
    logger.trace("Parsed period {} -> {}", text, period);
    return period;
  }

  @Override
  public String toString() {
    return "PeriodParser[normalize=" + normalize + "]";
  }
}
