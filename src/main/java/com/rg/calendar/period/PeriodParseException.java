package com.rg.calendar.period;

import java.util.Objects;

/** Thrown when a period string cannot be parsed; carries the structured {@link PeriodParseError}. */
public class PeriodParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final PeriodParseError error;

  public PeriodParseException(PeriodParseError error) {
    this(error, null);
  }

  public PeriodParseException(PeriodParseError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").message(), cause);
    this.error = error;
  }

  public PeriodParseError error() {
    return error;
  }

  public PeriodParseError.Kind kind() {
    return error.kind();
  }
}
