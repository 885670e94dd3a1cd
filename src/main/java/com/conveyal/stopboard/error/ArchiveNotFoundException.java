package com.conveyal.stopboard.error;

import java.io.File;

/**
 * An import was requested for a specific city whose feed archive has never been downloaded.
 */
public class ArchiveNotFoundException extends Exception {
    public ArchiveNotFoundException(File archive) {
        super(String.format("GTFS file not found: %s", archive.getPath()));
    }
}
