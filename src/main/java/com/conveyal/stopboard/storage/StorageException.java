package com.conveyal.stopboard.storage;

/**
 * Some errors are detected way down the call stack, inside a table load or a batch write, where we don't have the
 * context to report them per city. We throw this exception to signal the caller that something went wrong.
 * It also serves as a catch-all for SQL and IO problems that arise while storing a GTFS feed.
 */
public class StorageException extends RuntimeException {

    /** This is the string that will make it out to the client, explaining what went wrong. */
    public String badValue = null;

    public StorageException(String message, Exception ex) {
        super(message, ex);
        badValue = ex.toString();
    }

    /** This is the constructor for wrapping unexpected and unhandled exceptions. */
    public StorageException (Exception ex) {
        super(ex);
        // Expose the exception type and message to the outside world.
        badValue = ex.toString();
    }

}
