package com.conveyal.stopboard.loader;

/**
 * Field requirement levels, assigned to every field within a {@link Table}. A row missing a REQUIRED value, or
 * holding one that cannot be parsed, is skipped during import.
 */
public enum Requirement {
    REQUIRED,    // Required by the GTFS spec, or needed as a key by the store
    OPTIONAL     // Optional according to the GTFS spec
}
