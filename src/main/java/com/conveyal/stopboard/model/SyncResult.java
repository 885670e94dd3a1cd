package com.conveyal.stopboard.model;

import com.conveyal.stopboard.fetch.FetchResult;
import com.conveyal.stopboard.loader.FeedLoadResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * Per-city results of a download followed by an import.
 */
public class SyncResult implements Serializable {

    private static final long serialVersionUID = 1L;
    public Map<String, FetchResult> download;
    @JsonProperty("import")
    public Map<String, FeedLoadResult> importResults;

    public SyncResult () { }

    public SyncResult (Map<String, FetchResult> download, Map<String, FeedLoadResult> importResults) {
        this.download = download;
        this.importResults = importResults;
    }

}
