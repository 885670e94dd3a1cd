package com.conveyal.stopboard.loader;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An instance of this class is returned for every city an import was attempted for.
 * It provides a summary of what happened during the loading process: either per-table results, or the error that
 * aborted the city.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedLoadResult implements Serializable {

    private static final long serialVersionUID = 1L;
    public String city;
    public String filename;
    public boolean success;
    public String error;

    /** Keyed on table name, in import order. */
    @JsonIgnore
    public Map<String, TableLoadResult> tables = new LinkedHashMap<>();

    public long loadTimeMillis;

    public FeedLoadResult () { }

    public FeedLoadResult (String city, String filename) {
        this.city = city;
        this.filename = filename;
    }

    public static FeedLoadResult failure (String city, String filename, String error) {
        FeedLoadResult result = new FeedLoadResult(city, filename);
        result.success = false;
        result.error = error;
        return result;
    }

    /**
     * @return number of rows written per table, or null when the import failed.
     */
    public Map<String, Integer> getRowCounts () {
        if (!success) return null;
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        tables.forEach((name, table) -> rowCounts.put(name, table.rowCount));
        return rowCounts;
    }

    public int getSkippedCount () {
        return tables.values().stream().mapToInt(t -> t.skippedCount).sum();
    }

}
