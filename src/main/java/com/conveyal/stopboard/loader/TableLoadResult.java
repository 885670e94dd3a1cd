package com.conveyal.stopboard.loader;

import java.io.Serializable;

/**
 * An instance of this class is returned by the method that loads a single GTFS table.
 * It contains summary information about what happened while loading that one table.
 */
public class TableLoadResult implements Serializable {

    private static final long serialVersionUID = 1L;
    /** Rows written to the store, including rows that merged into an existing key. */
    public int rowCount;
    /** Rows dropped because a required or strict value was missing or unparseable. */
    public int skippedCount;
    public long fileSize;

    public TableLoadResult () { }

}
