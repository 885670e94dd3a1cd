package com.conveyal.stopboard.model;

import java.io.Serializable;

/**
 * Identity and position of a stop, as shown at the top of an arrival board.
 */
public class StopInfo implements Serializable {

    private static final long serialVersionUID = 1L;
    public String stop_id;
    public String stop_name;
    public Double stop_lat;
    public Double stop_lon;

    public StopInfo () { }

    public StopInfo (String stop_id, String stop_name, Double stop_lat, Double stop_lon) {
        this.stop_id = stop_id;
        this.stop_name = stop_name;
        this.stop_lat = stop_lat;
        this.stop_lon = stop_lon;
    }

    /**
     * Stand-in for a stop that is not in the store, so that live arrivals can still be shown for it.
     */
    public static StopInfo placeholder (String stopId) {
        return new StopInfo(stopId, "Stop " + stopId, null, null);
    }

}
