package com.conveyal.stopboard.model;

import java.io.Serializable;

/**
 * A route serving a stop, with the headsign of one of its trips and where the stop lies on that trip.
 */
public class RouteAtStop implements Serializable {

    private static final long serialVersionUID = 1L;
    public String route_id;
    public String route_short_name;
    public String route_long_name;
    public String route_color;
    public String route_text_color;
    public String trip_headsign;
    public StopPosition stop_position;

    public RouteAtStop () { }

}
