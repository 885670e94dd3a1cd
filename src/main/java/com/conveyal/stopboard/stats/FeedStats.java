package com.conveyal.stopboard.stats;

import com.conveyal.stopboard.loader.Table;
import org.apache.commons.dbutils.DbUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retrieves row counts for the static feed tables.
 */
public class FeedStats {

    private static final Logger LOG = LoggerFactory.getLogger(FeedStats.class);

    private final DataSource dataSource;

    public FeedStats (DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return the number of rows in every feed table, in import order. A table that cannot be counted (for example
     *         because nothing was imported yet) is reported as 0.
     */
    public Map<String, Integer> getRowCounts () {
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        for (Table table : Table.IMPORT_ORDER) {
            rowCounts.put(table.name, getRowCount(table));
        }
        return rowCounts;
    }

    public int getRowCount (Table table) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            try (Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery("select count(*) from " + table.name)) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        } catch (SQLException e) {
            // In case the table doesn't exist yet, just return zero.
            LOG.debug("Could not count rows in {}: {}", table.name, e.getMessage());
            return 0;
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    /**
     * @return true once at least one stop has been imported.
     */
    public boolean hasData () {
        return getRowCount(Table.STOPS) > 0;
    }

}
