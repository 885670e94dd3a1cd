package com.conveyal.stopboard.model;

import java.io.Serializable;

/**
 * One prediction scraped from the live arrivals page. These are never persisted.
 */
public class LiveArrival implements Serializable {

    private static final long serialVersionUID = 1L;
    /** Route label exactly as the live page shows it. */
    public String route_short_name;
    /** HH:MM:SS for relative predictions, or the page's own HH:MM text for absolute ones. */
    public String arrival_time;
    /** Whole minutes until arrival, never negative. */
    public int time_left;

    public LiveArrival () { }

    public LiveArrival (String route_short_name, String arrival_time, int time_left) {
        this.route_short_name = route_short_name;
        this.arrival_time = arrival_time;
        this.time_left = time_left;
    }

    @Override
    public String toString () {
        return String.format("%s at %s (%d min)", route_short_name, arrival_time, time_left);
    }

}
