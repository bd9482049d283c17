package com.rg.calendar.period;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class PeriodParserTest {

  private final Logger logger = (Logger) LoggerFactory.getLogger(PeriodParser.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  @BeforeEach
  void attachAppender() {
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void throwingParseLeavesReportingToCaller() {
    PeriodParser parser = PeriodParser.builder().build();

    PeriodParseException ex = assertThrows(PeriodParseException.class, () -> parser.parseOrThrow("PY"));

    assertEquals(PeriodParseError.Kind.MISSING_FIELD_NUMBER, ex.kind());
    assertTrue(appender.list.stream().noneMatch(e -> e.getLevel().isGreaterOrEqual(Level.WARN)));
  }

  @Test
  void rejectedInputIsLoggedAtDebug() {
    ParseResult result = PeriodParser.builder().build().parse("P1Y2Y");

    assertFalse(result.isSuccess());
    assertTrue(appender.list.stream().anyMatch(e ->
        e.getLevel() == Level.DEBUG && e.getFormattedMessage().contains("TRAILING_UNCONSUMED_TEXT")));
  }
}
