package com.rg.calendar.period;

/** Unit markers in the order they must appear within the date and time parts. */
enum Designator {
  YEARS('Y'),
  MONTHS('M'),
  WEEKS('W'),
  DAYS('D'),
  HOURS('H'),
  MINUTES('M'),
  SECONDS('S');

  private final char marker;

  Designator(char marker) {
    this.marker = marker;
  }

  char marker() {
    return marker;
  }

  /** Only seconds keep sub-unit precision; the other fields are whole counts. */
  boolean fractional() {
    return this == SECONDS;
  }
}
