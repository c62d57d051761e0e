package me.bantu.agent.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeExpressionParserTest {

    private static final LocalDateTime NEW_YEAR = LocalDateTime.of(2025, 1, 1, 0, 0);
    private static final LocalDateTime AFTERNOON = LocalDateTime.of(2025, 3, 10, 15, 20, 45);

    private TimeExpressionParser parser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T15:20:45Z"), ZoneOffset.UTC);
        parser = new TimeExpressionParser(clock);
    }

    // ===== Absolute =====

    @Test
    void shouldParseAbsoluteDateTime() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 10, 1, 14, 0)),
                parser.parse("2025-10-01 14:00", AFTERNOON));
    }

    @Test
    void shouldParseAbsoluteDateTimeInsideSentence() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 12, 24, 8, 5)),
                parser.parse("dinner on 2025-12-24 8:05 please", AFTERNOON));
    }

    @Test
    void shouldIgnoreImpossibleAbsoluteDate() {
        // falls through to the bare HH:MM rule
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 10, 0)),
                parser.parse("2025-02-30 10:00", AFTERNOON));
    }

    // ===== Relative =====

    @Test
    void shouldAddMinutesWithoutTruncation() {
        assertEquals(Optional.of(AFTERNOON.plusMinutes(30)), parser.parse("in 30 minutes", AFTERNOON));
    }

    @Test
    void shouldAddHours() {
        assertEquals(Optional.of(AFTERNOON.plusHours(2)), parser.parse("remind me In 2 Hours", AFTERNOON));
    }

    @Test
    void shouldAcceptSingularUnit() {
        assertEquals(Optional.of(AFTERNOON.plusHours(1)), parser.parse("in 1 hour", AFTERNOON));
    }

    // ===== Tomorrow =====

    @Test
    void shouldParseTomorrowWithAmPm() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 1, 2, 8, 0)), parser.parse("tomorrow at 8AM", NEW_YEAR));
    }

    @Test
    void shouldParseTomorrowWithClockTime() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 17, 45)),
                parser.parse("tomorrow 17:45", AFTERNOON));
    }

    @Test
    void shouldDefaultTomorrowToNineAm() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 9, 0)), parser.parse("Tomorrow", AFTERNOON));
    }

    @Test
    void shouldParseTwelveAmAsMidnight() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 0, 0)),
                parser.parse("tomorrow at 12am", AFTERNOON));
    }

    // ===== Today / at =====

    @Test
    void shouldKeepLaterTimeToday() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 10, 20, 0)), parser.parse("today at 8pm", AFTERNOON));
    }

    @Test
    void shouldRollPastTimeToNextDay() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 9, 0)), parser.parse("at 9am", AFTERNOON));
    }

    @Test
    void shouldRollCurrentMinuteToNextDay() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 15, 20)), parser.parse("at 15:20", AFTERNOON));
    }

    @Test
    void shouldParseInnerAtPhrase() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 10, 18, 30)),
                parser.parse("dentist at 18:30", AFTERNOON));
    }

    @Test
    void shouldParseTwelvePmAsNoon() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 12, 0)), parser.parse("at 12pm", AFTERNOON));
    }

    // ===== Bare time =====

    @Test
    void shouldParseBareAmPm() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 10, 23, 0)), parser.parse("11 pm", AFTERNOON));
    }

    @Test
    void shouldParseBareClockTime() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 7, 15)), parser.parse("7:15", AFTERNOON));
    }

    // ===== Unparseable =====

    @Test
    void shouldReturnEmptyForUnknownPhrase() {
        assertTrue(parser.parse("sometime next week", AFTERNOON).isEmpty());
    }

    @Test
    void shouldReturnEmptyForNull() {
        assertTrue(parser.parse(null, AFTERNOON).isEmpty());
    }

    @Test
    void shouldRejectOutOfRangeClockTime() {
        assertTrue(parser.parse("at 25:00", AFTERNOON).isEmpty());
    }

    @Test
    void shouldRejectRelativeTimePastYear9999() {
        assertTrue(parser.parse("in 80000000 hours", NEW_YEAR).isEmpty());
    }

    @Test
    void shouldRejectAmountTooLargeForLong() {
        assertTrue(parser.parse("in 99999999999999999999 minutes", NEW_YEAR).isEmpty());
    }

    @Test
    void shouldRejectAmountBeyondSupportedDates() {
        assertTrue(parser.parse("in 9000000000000000000 hours", NEW_YEAR).isEmpty());
    }

    @Test
    void shouldRejectTomorrowPastYear9999() {
        assertTrue(parser.parse("tomorrow", LocalDateTime.of(9999, 12, 31, 10, 0)).isEmpty());
    }

    @Test
    void shouldIgnoreAbsoluteYearZero() {
        // falls through to the bare HH:MM rule
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 10, 0)),
                parser.parse("0000-01-01 10:00", AFTERNOON));
    }

    @Test
    void shouldUseClockWhenNowNotGiven() {
        assertEquals(Optional.of(LocalDateTime.of(2025, 3, 11, 9, 0)), parser.parse("tomorrow"));
    }

    @Test
    void shouldConvertTo24Hour() {
        assertEquals(0, TimeExpressionParser.to24Hour(12, "am"));
        assertEquals(12, TimeExpressionParser.to24Hour(12, "PM"));
        assertEquals(13, TimeExpressionParser.to24Hour(1, "pm"));
        assertEquals(7, TimeExpressionParser.to24Hour(7, "AM"));
    }
}
