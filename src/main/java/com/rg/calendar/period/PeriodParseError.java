package com.rg.calendar.period;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a period string was rejected.
 *
 * @param kind what went wrong
 * @param input the complete text handed to the parser
 * @param designator the unit marker being parsed, or null when the failure is not field specific
 * @param detail extra context (leftover text, underlying number error), or null
 */
public record PeriodParseError(
    Kind kind,
    String input,
    Character designator,
    String detail
) {
  public PeriodParseError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(input, "input");
  }

  public enum Kind {
    EMPTY_OR_SIGN_ONLY_INPUT,
    MISSING_PERIOD_MARKER,
    MISSING_FIELD_NUMBER,
    MALFORMED_FIELD_NUMBER,
    TRAILING_UNCONSUMED_TEXT,
    NO_FIELDS_MATCHED
  }

  public Optional<Character> designatorMarker() {
    return Optional.ofNullable(designator);
  }

  public String message() {
    String text = switch (kind) {
      case EMPTY_OR_SIGN_ONLY_INPUT -> "cannot parse a blank string as a period";
      case MISSING_PERIOD_MARKER -> "expected 'P' period mark at the start";
      case MISSING_FIELD_NUMBER -> "expected a number before the '" + designator + "' designator";
      case MALFORMED_FIELD_NUMBER -> "malformed number before the '" + designator + "' designator";
      case TRAILING_UNCONSUMED_TEXT -> "unexpected remaining components " + detail;
      case NO_FIELDS_MATCHED -> "expected 'Y', 'M', 'W', 'D', 'H', 'M', or 'S' designator";
    };
    if (detail != null && kind == Kind.MALFORMED_FIELD_NUMBER) {
      text = text + " (" + detail + ")";
    }
    return text + ": " + input;
  }
}
