package com.rg.calendar.period;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class PeriodFormatterTest {

  @Test
  void writesComponentsInOrder() {
    assertEquals("P1Y2M25DT5H6M7.8S", PeriodFormatter.format(new Period(1, 2, 25, 5, 6, 7800)));
    assertEquals("PT1H", PeriodFormatter.format(Period.ofHours(1)));
    assertEquals("P1DT30M", PeriodFormatter.format(new Period(0, 0, 1, 0, 30, 0)));
  }

  @Test
  void zeroIsDays() {
    assertEquals("P0D", PeriodFormatter.format(Period.ZERO));
  }

  @Test
  void weeksAreWrittenAsDays() {
    assertEquals("P14D", PeriodFormatter.format(Period.ofWeeks(2)));
  }

  @Test
  void secondsUseMinimalFractionDigits() {
    assertEquals("PT90S", PeriodFormatter.format(Period.ofSeconds(90)));
    assertEquals("PT0.25S", PeriodFormatter.format(Period.ofMillis(250)));
    assertEquals("PT1.5S", PeriodFormatter.format(Period.ofMillis(1500)));
  }

  @Test
  void allNegativeGetsSingleLeadingSign() {
    assertEquals("-P1Y2M", PeriodFormatter.format(new Period(-1, -2, 0, 0, 0, 0)));
    assertEquals("-PT0.5S", PeriodFormatter.format(Period.ofMillis(-500)));
  }

  @Test
  void mixedSignsAreWrittenPerField() {
    assertEquals("P1Y-2M", PeriodFormatter.format(new Period(1, -2, 0, 0, 0, 0)));
    assertEquals("P1DT-0.5S", PeriodFormatter.format(new Period(0, 0, 1, 0, 0, -500)));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "P1Y2M3W4DT5H6M7.8S", "-P1Y", "P-1Y13M", "PT0.5S", "P0", "PT1,5S", "P1DT",
      "+P36M", "PT-1.5S", "-P2DT3H", "P1Y-2M", "P1DT-0.5S", "PT123456789S", "P10W"
  })
  void reparsingFormattedTextGivesSameValue(String text) {
    Period first = Periods.parseOrThrow(text);
    Period second = Periods.parseOrThrow(first.toString());

    assertEquals(first, second);
    assertEquals(first.toString(), second.toString());
  }

  @Test
  void unnormalizedValuesSurviveReparseWithoutNormalizing() {
    Period raw = Periods.parseOrThrow("P1Y30M", false);
    assertEquals("P1Y30M", raw.toString());
    assertEquals(raw, Periods.parseOrThrow(raw.toString(), false));
  }

  @Test
  void digitsDoNotDependOnDefaultLocale() {
    Locale saved = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
    try {
      Period p = Periods.parseOrThrow("PT1.5S");

      assertEquals("PT1.5S", p.toString());
      assertEquals("PT0.25S", Period.ofMillis(250).toString());
      assertEquals(p, Periods.parseOrThrow(p.toString()));
    } finally {
      Locale.setDefault(saved);
    }
  }
}
