package com.conveyal.stopboard.realtime;

import com.conveyal.stopboard.model.Arrival;
import com.conveyal.stopboard.model.LiveArrival;
import com.conveyal.stopboard.model.RouteAtStop;
import com.conveyal.stopboard.util.RouteNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins live predictions to the static routes serving a stop. Live labels and route short names are compared by
 * their {@link RouteNames#canonicalize(String) canonical key}, since the website and the feed spell them differently.
 */
public abstract class ArrivalFusion {

    public static final String DEFAULT_HEADSIGN = "Unknown Destination";
    public static final String DEFAULT_COLOR = "FFFFFF";
    public static final String DEFAULT_TEXT_COLOR = "000000";

    /**
     * @param liveArrivals predictions in page order
     * @param knownRoutes  routes serving the stop; when several share a canonical short name the first one wins
     * @return one arrival per prediction, sorted by minutes left. Equal waits keep their page order.
     */
    public static List<Arrival> enrich (List<LiveArrival> liveArrivals, List<RouteAtStop> knownRoutes) {
        Map<String, RouteAtStop> routesByKey = new HashMap<>();
        for (RouteAtStop route : knownRoutes) {
            String key = RouteNames.canonicalize(route.route_short_name);
            if (!key.isEmpty()) routesByKey.putIfAbsent(key, route);
        }
        List<Arrival> arrivals = new ArrayList<>(liveArrivals.size());
        for (LiveArrival live : liveArrivals) {
            RouteAtStop route = routesByKey.get(RouteNames.canonicalize(live.route_short_name));
            Arrival arrival = new Arrival();
            arrival.route_short_name = live.route_short_name;
            arrival.arrival_time = live.arrival_time;
            arrival.time_left = live.time_left;
            arrival.is_live = true;
            if (route != null) {
                arrival.route_id = route.route_id;
                arrival.trip_headsign = orDefault(route.trip_headsign, DEFAULT_HEADSIGN);
                arrival.route_color = orDefault(route.route_color, DEFAULT_COLOR);
                arrival.route_text_color = orDefault(route.route_text_color, DEFAULT_TEXT_COLOR);
            } else {
                arrival.trip_headsign = DEFAULT_HEADSIGN;
                arrival.route_color = DEFAULT_COLOR;
                arrival.route_text_color = DEFAULT_TEXT_COLOR;
            }
            arrivals.add(arrival);
        }
        // List.sort is stable.
        arrivals.sort(Comparator.comparingInt(arrival -> arrival.time_left));
        return arrivals;
    }

    private static String orDefault (String value, String defaultValue) {
        return value == null || value.isEmpty() ? defaultValue : value;
    }

}
