package com.conveyal.stopboard.error;

/**
 * Thrown when a single value (a GTFS time, a numeric CSV field) cannot be parsed. Callers recover locally by
 * skipping the offending row or field, so this never aborts a whole table load.
 */
public class ValueParseException extends RuntimeException {

    /** The raw value that failed to parse, exposed so it can be logged alongside table and line. */
    public final String badValue;

    public ValueParseException(String message, String badValue) {
        super(String.format("%s: '%s'", message, badValue));
        this.badValue = badValue;
    }

    public ValueParseException(String message, String badValue, Throwable cause) {
        super(String.format("%s: '%s'", message, badValue), cause);
        this.badValue = badValue;
    }
}
