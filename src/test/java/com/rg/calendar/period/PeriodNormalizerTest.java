package com.rg.calendar.period;

import com.rg.calendar.period.PeriodNormalizer.YearsMonths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class PeriodNormalizerTest {

  @ParameterizedTest
  @CsvSource({
      "0,  24,  2,  0",
      "1,  11,  1,  11",
      "-1, 13,  0,  1",
      "1,  -13, 0,  -1",
      "2,  -1,  1,  11",
      "-2, 1,   -1, -11",
      "0,  -25, -2, -1",
      "5,  0,   5,  0"
  })
  void foldsWholeYearsOfMonths(long years, long months, long expectedYears, long expectedMonths) {
    assertEquals(new YearsMonths(expectedYears, expectedMonths), PeriodNormalizer.reduce(years, months));
  }

  @Test
  void preservesTotalMonthsWithSignConsistentRemainder() {
    for (long y = -30; y <= 30; y++) {
      for (long m = -40; m <= 40; m++) {
        YearsMonths ym = PeriodNormalizer.reduce(y, m);
        long total = y * 12 + m;

        assertEquals(total, ym.years() * 12 + ym.months(), "total for " + y + "Y" + m + "M");
        assertTrue(Math.abs(ym.months()) < 12);
        assertTrue(ym.months() == 0 || Long.signum(ym.months()) == Long.signum(total));
        assertEquals(total / 12, ym.years());
      }
    }
  }

  @Test
  void leavesDaysAndTimeUntouched() {
    RawPeriod raw = new RawPeriod(0, 25, 400, 30, 90, 75_500, true, "-P25M400DT30H90M75.5S");

    RawPeriod normalized = PeriodNormalizer.normalize(raw);

    assertEquals(2, normalized.years());
    assertEquals(1, normalized.months());
    assertEquals(400, normalized.days());
    assertEquals(30, normalized.hours());
    assertEquals(90, normalized.minutes());
    assertEquals(75_500, normalized.seconds());
    assertTrue(normalized.negative());
    assertEquals(raw.originalText(), normalized.originalText());
  }

  @Test
  void overflowingYearsAreReported() {
    assertThrows(ArithmeticException.class, () -> PeriodNormalizer.reduce(Long.MAX_VALUE, 12));
  }
}
