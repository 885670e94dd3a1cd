package com.conveyal.stopboard.model;

import java.io.Serializable;

/**
 * A live prediction joined to the static route it belongs to, or to default display values when no route matched.
 */
public class Arrival implements Serializable {

    private static final long serialVersionUID = 1L;
    public String route_short_name;
    public String arrival_time;
    public int time_left;
    public String route_id;
    public String trip_headsign;
    public String route_color;
    public String route_text_color;
    public boolean is_live = true;

    public Arrival () { }

}
