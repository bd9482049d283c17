package com.rg.calendar.date;

/** ISO-8601 week-based year and week number. */
public record IsoWeek(int year, int week) {
  public IsoWeek {
    if (week < 1 || week > 53) throw new IllegalArgumentException("week must be 1..53");
  }
}
