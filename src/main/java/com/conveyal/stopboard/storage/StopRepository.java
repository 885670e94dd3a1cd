package com.conveyal.stopboard.storage;

import com.conveyal.stopboard.model.RouteAtStop;
import com.conveyal.stopboard.model.StopInfo;
import com.conveyal.stopboard.model.StopPosition;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.commons.dbutils.DbUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.conveyal.stopboard.realtime.ArrivalFusion.DEFAULT_COLOR;
import static com.conveyal.stopboard.realtime.ArrivalFusion.DEFAULT_TEXT_COLOR;

/**
 * Read queries against the imported static feed tables.
 */
public class StopRepository {

    private static final Logger LOG = LoggerFactory.getLogger(StopRepository.class);

    /**
     * Every visit of a trip to the stop, with the first and last stop sequence of that trip. The bounds are computed
     * only for trips that visit the stop.
     */
    private static final String ROUTES_FOR_STOP_SQL = String.join(" ",
        "select r.route_id, r.route_short_name, r.route_long_name, r.route_color, r.route_text_color,",
        "t.trip_headsign, st.stop_sequence, bounds.min_sequence, bounds.max_sequence",
        "from stop_times st",
        "join trips t on t.trip_id = st.trip_id",
        "join routes r on r.route_id = t.route_id",
        "join (select s.trip_id, min(s.stop_sequence) as min_sequence, max(s.stop_sequence) as max_sequence",
        "  from stop_times s",
        "  where s.trip_id in (select v.trip_id from stop_times v where v.stop_id = ?)",
        "  group by s.trip_id) bounds on bounds.trip_id = st.trip_id",
        "where st.stop_id = ?",
        "order by r.route_short_name, t.trip_id, st.stop_sequence"
    );

    private final DataSource dataSource;

    public StopRepository (DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return the stop, or null if it is not in the store
     * @throws StorageException if the query fails
     */
    public StopInfo getStop (String stopId) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            try (PreparedStatement statement = connection.prepareStatement(
                "select stop_id, stop_name, stop_lat, stop_lon from stops where stop_id = ?")) {
                statement.setString(1, stopId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) return null;
                    return new StopInfo(
                        resultSet.getString("stop_id"),
                        resultSet.getString("stop_name"),
                        getDouble(resultSet, "stop_lat"),
                        getDouble(resultSet, "stop_lon")
                    );
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Could not read stop " + stopId, e);
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    /**
     * Find the routes serving a stop. Several routes can share a short name (one per direction, for instance) and
     * only the first is kept, in order of short name then trip id. The headsign and position come from the first
     * visit of the first trip of that route.
     *
     * @return routes ordered by short name, or an empty list if the query fails
     */
    public List<RouteAtStop> getRoutesForStop (String stopId) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            List<RouteAtStop> routes = new ArrayList<>();
            Set<String> seenShortNames = new HashSet<>();
            try (PreparedStatement statement = connection.prepareStatement(ROUTES_FOR_STOP_SQL)) {
                statement.setString(1, stopId);
                statement.setString(2, stopId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        String shortName = resultSet.getString("route_short_name");
                        if (!seenShortNames.add(Strings.nullToEmpty(shortName))) continue;
                        RouteAtStop route = new RouteAtStop();
                        route.route_id = resultSet.getString("route_id");
                        route.route_short_name = shortName;
                        route.route_long_name = resultSet.getString("route_long_name");
                        route.route_color = withDefault(resultSet.getString("route_color"), DEFAULT_COLOR);
                        route.route_text_color = withDefault(resultSet.getString("route_text_color"), DEFAULT_TEXT_COLOR);
                        route.trip_headsign = resultSet.getString("trip_headsign");
                        route.stop_position = StopPosition.of(
                            resultSet.getInt("stop_sequence"),
                            resultSet.getInt("min_sequence"),
                            resultSet.getInt("max_sequence")
                        );
                        routes.add(route);
                    }
                }
            }
            return routes;
        } catch (SQLException e) {
            LOG.error("Error getting routes for stop {}: {}", stopId, e.getMessage());
            return ImmutableList.of();
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    private static Double getDouble (ResultSet resultSet, String column) throws SQLException {
        double value = resultSet.getDouble(column);
        return resultSet.wasNull() ? null : value;
    }

    private static String withDefault (String value, String defaultValue) {
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }

}
