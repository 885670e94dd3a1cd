package com.conveyal.stopboard.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The arrival board payload for one stop.
 */
public class StopArrivals implements Serializable {

    private static final long serialVersionUID = 1L;
    public StopInfo stop_info;
    public List<Arrival> arrivals = new ArrayList<>();
    public List<RouteAtStop> routes = new ArrayList<>();

    public StopArrivals () { }

    public StopArrivals (StopInfo stop_info, List<Arrival> arrivals, List<RouteAtStop> routes) {
        this.stop_info = stop_info;
        this.arrivals = arrivals;
        this.routes = routes;
    }

}
