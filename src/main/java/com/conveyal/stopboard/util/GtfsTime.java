package com.conveyal.stopboard.util;

import com.conveyal.stopboard.error.ValueParseException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Conversions between GTFS time strings (H:MM:SS, where the hour may run past 24 to denote the following service
 * day), calendar timestamps in the fixed Cyprus offset, and raw seconds since midnight.
 *
 * Every timestamp produced here is expressed in {@link #CYPRUS_OFFSET}, a fixed offset with no daylight saving.
 * Schedule and live times are both treated as local wall-clock values in that offset.
 */
public abstract class GtfsTime {

    public static final ZoneOffset CYPRUS_OFFSET = ZoneOffset.ofHours(2);

    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

    /**
     * @return the current time in the Cyprus offset according to the supplied clock.
     */
    public static OffsetDateTime now (Clock clock) {
        return OffsetDateTime.now(clock).withOffsetSameInstant(CYPRUS_OFFSET);
    }

    /**
     * Parse a GTFS time string as a timestamp on the reference date. Times at or past 24:00:00 roll over onto the
     * following day(s), so "25:30:00" against reference day D yields D+1 at 01:30:00. Missing minute and second
     * components default to zero, so "19:30" is accepted.
     *
     * @param time      time string in H:MM:SS form, hour unbounded
     * @param reference the service day the time is anchored to; converted to the Cyprus offset first
     * @throws ValueParseException if the string is empty or any component is not a non-negative integer
     */
    public static OffsetDateTime parseGtfsTime (String time, OffsetDateTime reference) {
        int[] hms = parseComponents(time);
        int daysOffset = hms[0] / 24;
        int hours = hms[0] % 24;
        OffsetDateTime anchored = reference.withOffsetSameInstant(CYPRUS_OFFSET);
        try {
            return anchored
                .withHour(hours)
                .withMinute(hms[1])
                .withSecond(hms[2])
                .withNano(0)
                .plusDays(daysOffset);
        } catch (DateTimeException e) {
            throw new ValueParseException("Time out of range", time, e);
        }
    }

    /**
     * Format a timestamp as HH:MM:SS wall-clock time in the Cyprus offset.
     */
    public static String formatGtfsTime (OffsetDateTime dateTime) {
        return dateTime.withOffsetSameInstant(CYPRUS_OFFSET).format(HH_MM_SS);
    }

    /**
     * Convert a GTFS time string to seconds since midnight without reducing hours past 24, so "25:30:00" is 91800.
     * This raw form is for duration arithmetic only.
     *
     * @throws ValueParseException if the string is malformed or the total does not fit in an int
     */
    public static int timeToSeconds (String time) {
        int[] hms = parseComponents(time);
        try {
            return Math.addExact(Math.addExact(Math.multiplyExact(hms[0], 3600), Math.multiplyExact(hms[1], 60)), hms[2]);
        } catch (ArithmeticException e) {
            throw new ValueParseException("Time out of range", time, e);
        }
    }

    /**
     * Inverse of {@link #timeToSeconds(String)}. Values past 86400 produce hours of 24 or more.
     */
    public static String secondsToTime (int seconds) {
        if (seconds < 0) throw new IllegalArgumentException("Seconds since midnight must not be negative: " + seconds);
        int hours = seconds / 3600;
        int minutes = (seconds % 3600) / 60;
        int secs = seconds % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, secs);
    }

    private static int[] parseComponents (String time) {
        if (time == null || time.trim().isEmpty()) {
            throw new ValueParseException("Time string cannot be empty", String.valueOf(time));
        }
        String[] parts = time.trim().split(":", -1);
        if (parts.length > 3) throw new ValueParseException("Too many time components", time);
        int[] hms = new int[3];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.isEmpty()) {
                if (i == 0) throw new ValueParseException("Missing hour", time);
                throw new ValueParseException("Empty time component", time);
            }
            try {
                hms[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new ValueParseException("Non-numeric time component", time, e);
            }
            if (hms[i] < 0) throw new ValueParseException("Negative time component", time);
        }
        return hms;
    }

}
