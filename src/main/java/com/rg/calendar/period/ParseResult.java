package com.rg.calendar.period;

import java.util.Objects;
import java.util.Optional;

/** Outcome of parsing a period string: either a {@link Period} or the reason it was rejected. */
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Failed {

  boolean isSuccess();

  Optional<Period> period();

  Optional<PeriodParseError> error();

  /** Returns the parsed period, or throws {@link PeriodParseException} for a failure. */
  Period orElseThrow();

  record Parsed(Period value) implements ParseResult {
    public Parsed {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Optional<Period> period() {
      return Optional.of(value);
    }

    @Override
    public Optional<PeriodParseError> error() {
      return Optional.empty();
    }

    @Override
    public Period orElseThrow() {
      return value;
    }
  }

  record Failed(PeriodParseError failure) implements ParseResult {
    public Failed {
      Objects.requireNonNull(failure, "failure");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Optional<Period> period() {
      return Optional.empty();
    }

    @Override
    public Optional<PeriodParseError> error() {
      return Optional.of(failure);
    }

    @Override
    public Period orElseThrow() {
      throw new PeriodParseException(failure);
    }
  }
}
