package com.conveyal.stopboard.util;

import com.conveyal.stopboard.error.ValueParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GtfsTimeTest {

    private static final OffsetDateTime REFERENCE = OffsetDateTime.of(2024, 5, 1, 14, 42, 17, 0, GtfsTime.CYPRUS_OFFSET);

    @Test
    public void canParseTimeOnReferenceDay() {
        OffsetDateTime parsed = GtfsTime.parseGtfsTime("08:15:30", REFERENCE);
        assertThat(parsed, equalTo(OffsetDateTime.of(2024, 5, 1, 8, 15, 30, 0, GtfsTime.CYPRUS_OFFSET)));
    }

    @Test
    public void timesPastMidnightRollOverToNextDay() {
        OffsetDateTime parsed = GtfsTime.parseGtfsTime("25:30:00", REFERENCE);
        assertThat(parsed, equalTo(OffsetDateTime.of(2024, 5, 2, 1, 30, 0, 0, GtfsTime.CYPRUS_OFFSET)));
        OffsetDateTime twoDaysLater = GtfsTime.parseGtfsTime("48:00:00", REFERENCE);
        assertThat(twoDaysLater, equalTo(OffsetDateTime.of(2024, 5, 3, 0, 0, 0, 0, GtfsTime.CYPRUS_OFFSET)));
    }

    @Test
    public void missingMinutesAndSecondsDefaultToZero() {
        assertThat(GtfsTime.parseGtfsTime("19", REFERENCE).getHour(), equalTo(19));
        OffsetDateTime parsed = GtfsTime.parseGtfsTime("19:30", REFERENCE);
        assertThat(GtfsTime.formatGtfsTime(parsed), equalTo("19:30:00"));
    }

    @Test
    public void referenceInAnotherOffsetIsConvertedFirst() {
        // 23:30 UTC on April 30th is already May 1st in Cyprus.
        OffsetDateTime utcReference = OffsetDateTime.of(2024, 4, 30, 23, 30, 0, 0, ZoneOffset.UTC);
        OffsetDateTime parsed = GtfsTime.parseGtfsTime("07:00:00", utcReference);
        assertThat(parsed, equalTo(OffsetDateTime.of(2024, 5, 1, 7, 0, 0, 0, GtfsTime.CYPRUS_OFFSET)));
    }

    @Test
    public void formatsInCyprusOffset() {
        OffsetDateTime utc = OffsetDateTime.of(2024, 5, 1, 22, 5, 9, 0, ZoneOffset.UTC);
        assertThat(GtfsTime.formatGtfsTime(utc), equalTo("00:05:09"));
    }

    @Test
    public void nowUsesSuppliedClock() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        OffsetDateTime now = GtfsTime.now(clock);
        assertThat(now.getOffset(), equalTo(GtfsTime.CYPRUS_OFFSET));
        assertThat(now.getHour(), equalTo(12));
    }

    @Test
    public void secondsAreNotReducedPastMidnight() {
        assertThat(GtfsTime.timeToSeconds("25:30:00"), equalTo(91800));
        assertThat(GtfsTime.timeToSeconds("00:00:00"), equalTo(0));
        assertThat(GtfsTime.secondsToTime(91800), equalTo("25:30:00"));
        assertThat(GtfsTime.secondsToTime(59), equalTo("00:00:59"));
    }

    @Test
    public void rawTimeRoundTripsForTwoServiceDays() {
        for (int h = 0; h <= 47; h++) {
            for (int m = 0; m <= 59; m += 7) {
                for (int s = 0; s <= 59; s += 13) {
                    String time = String.format("%02d:%02d:%02d", h, m, s);
                    assertThat(GtfsTime.secondsToTime(GtfsTime.timeToSeconds(time)), equalTo(time));
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", ":30:00", "ab:30:00", "12:x:00", "12:30:0s", "12:-5:00", "1:2:3:4", "12::00"})
    public void malformedTimesAreRejected(String time) {
        assertThrows(ValueParseException.class, () -> GtfsTime.timeToSeconds(time));
        assertThrows(ValueParseException.class, () -> GtfsTime.parseGtfsTime(time, REFERENCE));
    }

    @Test
    public void nullTimeIsRejected() {
        assertThrows(ValueParseException.class, () -> GtfsTime.timeToSeconds(null));
    }

    @Test
    public void minutesOutOfRangeAreRejectedWhenAnchoring() {
        // Raw seconds accept any minute value, but a wall-clock time cannot have 75 minutes.
        assertThrows(ValueParseException.class, () -> GtfsTime.parseGtfsTime("10:75:00", REFERENCE));
    }

    @Test
    public void hugeHoursAreRejectedInsteadOfOverflowing() {
        assertThrows(ValueParseException.class, () -> GtfsTime.timeToSeconds("600000:00:00"));
        assertThrows(ValueParseException.class, () -> GtfsTime.timeToSeconds("596523:14:08"));
        assertThrows(ValueParseException.class, () -> GtfsTime.timeToSeconds("0:2000000000:00"));
        // The largest representable time still converts.
        assertThat(GtfsTime.timeToSeconds("596523:14:07"), equalTo(Integer.MAX_VALUE));
    }

    @Test
    public void negativeSecondsCannotBeFormatted() {
        assertThrows(IllegalArgumentException.class, () -> GtfsTime.secondsToTime(-1));
    }

}
