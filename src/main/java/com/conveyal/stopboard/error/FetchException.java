package com.conveyal.stopboard.error;

/**
 * A remote resource could not be retrieved: connection failure, timeout or a non-2xx status. Inside a multi-city
 * download this is recorded in the city's result rather than thrown to the caller.
 */
public class FetchException extends Exception {
    public FetchException(String message) {
        super(message);
    }
}
