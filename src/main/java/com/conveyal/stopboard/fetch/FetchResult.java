package com.conveyal.stopboard.fetch;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Outcome of downloading one city's feed archive. Failures are reported here rather than thrown, so that one city
 * failing never affects the others in the same run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FetchResult implements Serializable {

    private static final long serialVersionUID = 1L;
    public String city;
    public boolean success;
    public String error;
    public String file;
    public Long sizeBytes;

    public FetchResult () { }

    public static FetchResult success (String city, String file, long sizeBytes) {
        FetchResult result = new FetchResult();
        result.city = city;
        result.success = true;
        result.file = file;
        result.sizeBytes = sizeBytes;
        return result;
    }

    public static FetchResult failure (String city, String error) {
        FetchResult result = new FetchResult();
        result.city = city;
        result.success = false;
        result.error = error;
        return result;
    }

    @Override
    public String toString () {
        return success
            ? String.format("%s: %d bytes written to %s", city, sizeBytes, file)
            : String.format("%s: failed (%s)", city, error);
    }

}
