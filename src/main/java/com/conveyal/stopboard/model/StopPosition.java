package com.conveyal.stopboard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a stop falls within a trip's visitation order.
 */
public enum StopPosition {
    ORIGIN, DESTINATION, INTERMEDIATE;

    /**
     * Classify a stop sequence number against the first and last sequence numbers of its trip. A trip visiting a
     * single stop yields ORIGIN.
     */
    public static StopPosition of (int stopSequence, int minSequence, int maxSequence) {
        if (stopSequence == minSequence) return ORIGIN;
        if (stopSequence == maxSequence) return DESTINATION;
        return INTERMEDIATE;
    }

    @JsonValue
    public String toJson () {
        return name().toLowerCase(Locale.ROOT);
    }
}
