package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;
import com.conveyal.stopboard.storage.StorageException;
import org.apache.commons.dbutils.DbUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static com.conveyal.stopboard.util.Util.human;

/**
 * This class loads the CSV tables of one zipped city feed into an SQL database with a JDBC driver.
 *
 * Tables are shared between cities and between successive imports of the same city. Every row is written with an
 * upsert whose conflict behavior is given by the table's {@link MergePolicy}, so importing the same archive again
 * never duplicates a key and only refreshes the columns the feed is authoritative for.
 *
 * Tables are loaded in {@link Table#IMPORT_ORDER}, so that every foreign key target is present before the rows
 * referencing it. The store enforces these foreign keys: a row pointing at a missing target aborts the city. Rows
 * with missing or unparseable required values are skipped one by one instead.
 *
 * Each table is committed when it is complete. Batched tables (stop times and shapes) are also committed after
 * every batch, so when a city fails part way through such a table the batches written so far stay in the store.
 */
public class FeedImporter {

    private static final Logger LOG = LoggerFactory.getLogger(FeedImporter.class);

    public static final int DEFAULT_BATCH_SIZE = 500;

    private final DataSource dataSource;
    private final int batchSize;

    public FeedImporter (DataSource dataSource) {
        this(dataSource, DEFAULT_BATCH_SIZE);
    }

    public FeedImporter (DataSource dataSource, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be positive");
        this.dataSource = dataSource;
        this.batchSize = batchSize;
    }

    /**
     * Create all tables if they do not exist yet, so that queries against an empty store succeed.
     */
    public void createTables () {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            createTables(connection);
        } catch (SQLException e) {
            throw new StorageException("Could not create tables", e);
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    private static void createTables (Connection connection) throws SQLException {
        for (Table table : Table.IMPORT_ORDER) {
            table.createSqlTable(connection);
        }
        connection.commit();
    }

    /**
     * Load every table of one city's feed archive.
     *
     * @return a successful load result with per-table row counts
     * @throws StorageException if the archive cannot be opened or any write fails. Batches committed before the
     *                          failure remain in the store.
     */
    public FeedLoadResult importFeed (String city, File archive) {
        FeedLoadResult result = new FeedLoadResult(city, archive.getName());
        long startTime = System.currentTimeMillis();
        Connection connection = null;
        // We get a single connection object and share it across all tables, so that each table sees the
        // rows committed for the tables before it.
        try (FeedArchiveReader reader = FeedArchiveReader.open(archive)) {
            connection = dataSource.getConnection();
            // Commits are issued explicitly per table and per batch.
            connection.setAutoCommit(false);
            createTables(connection);
            LOG.info("Importing feed for {} from {}", city, archive);
            for (Table table : Table.IMPORT_ORDER) {
                result.tables.put(table.name, load(connection, reader, table));
            }
            createIndexes(connection);
            result.success = true;
            result.loadTimeMillis = System.currentTimeMillis() - startTime;
            LOG.info("Importing {} took {} sec, {} rows skipped", city, result.loadTimeMillis / 1000,
                result.getSkippedCount());
            return result;
        } catch (SQLException | IOException e) {
            LOG.error("Exception while importing feed for {}: {}", city, e.toString());
            rollbackQuietly(connection);
            throw new StorageException(String.format("Import of %s failed", city), e);
        } finally {
            if (connection != null) DbUtils.closeQuietly(connection);
        }
    }

    /**
     * Stream one table from the archive into the store. Rows are bound and batched as they are read, so memory use
     * does not grow with the table size. This function will throw any SQL or IO exception that occurs. Those
     * exceptions abort the whole city.
     */
    private TableLoadResult load (Connection connection, FeedArchiveReader reader, Table table)
        throws SQLException, IOException {
        TableLoadResult tableLoadResult = new TableLoadResult();
        tableLoadResult.fileSize = reader.getTableSize(table.name);
        if (table == Table.CALENDAR_DATES) {
            synthesizeMissingCalendars(connection, collectServiceIds(reader));
        }
        try (FeedArchiveReader.TableRows rows = reader.openTable(table.name)) {
            if (rows == null) {
                LOG.info("No rows to load for table {}", table.name);
                return tableLoadResult;
            }
            LOG.info("Loading {} ({} bytes) into table {}", rows.getEntryName(), human(tableLoadResult.fileSize),
                table.name);
            try (PreparedStatement insertStatement = connection.prepareStatement(table.generateUpsertSql())) {
                BatchTracker batchTracker = new BatchTracker(
                    table.name, connection, insertStatement, batchSize, table.isBatched()
                );
                for (Map<String, String> row = rows.next(); row != null; row = rows.next()) {
                    try {
                        table.setStatementParameters(insertStatement, row);
                    } catch (ValueParseException e) {
                        LOG.debug("Skipping {} line {}: {}", table.fileName, rows.getLineNumber(), e.getMessage());
                        tableLoadResult.skippedCount += 1;
                        insertStatement.clearParameters();
                        continue;
                    }
                    batchTracker.addBatch();
                }
                tableLoadResult.rowCount = batchTracker.executeRemaining();
            }
        }
        connection.commit();
        if (tableLoadResult.skippedCount > 0) {
            LOG.warn("Skipped {} invalid rows in {}", tableLoadResult.skippedCount, table.fileName);
        }
        return tableLoadResult;
    }

    /**
     * Read the distinct, non-empty service ids referenced by the archive's calendar_dates table, keeping only the ids
     * in memory.
     */
    static Set<String> collectServiceIds (FeedArchiveReader reader) throws IOException {
        Set<String> serviceIds = new LinkedHashSet<>();
        try (FeedArchiveReader.TableRows rows = reader.openTable(Table.CALENDAR_DATES.name)) {
            if (rows == null) return serviceIds;
            for (Map<String, String> row = rows.next(); row != null; row = rows.next()) {
                String serviceId = row.get("service_id");
                if (serviceId != null && !serviceId.isEmpty()) serviceIds.add(serviceId);
            }
        }
        return serviceIds;
    }

    /**
     * Insert a placeholder calendar row for every given service, leaving existing calendar rows untouched. The
     * placeholder runs on no day of the week and spans the whole practical date range, so service is defined entirely
     * by the calendar_dates exceptions.
     *
     * @return the number of placeholder rows actually created
     */
    static int synthesizeMissingCalendars (Connection connection, Set<String> serviceIds) throws SQLException {
        String sql = String.format(
            "insert into calendar (service_id, monday, tuesday, wednesday, thursday, friday, saturday, sunday, " +
                "start_date, end_date) values (?, 0, 0, 0, 0, 0, 0, 0, %d, %d) on conflict (service_id) do nothing",
            Table.PLACEHOLDER_START_DATE,
            Table.PLACEHOLDER_END_DATE
        );
        int created = 0;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (String serviceId : serviceIds) {
                statement.setString(1, serviceId);
                created += Math.max(statement.executeUpdate(), 0);
            }
        }
        if (created > 0) LOG.info("Created {} placeholder calendar rows for calendar_dates services", created);
        return created;
    }

    /**
     * Create the query support indexes. This is best effort: each index is created in its own transaction and a
     * failure is rolled back and logged without affecting the import result.
     */
    private static void createIndexes (Connection connection) {
        for (Table table : Table.IMPORT_ORDER) {
            for (String indexSql : table.getIndexSql()) {
                try (Statement statement = connection.createStatement()) {
                    statement.execute(indexSql);
                    connection.commit();
                } catch (SQLException e) {
                    LOG.debug("Index creation skipped ({}): {}", indexSql, e.getMessage());
                    rollbackQuietly(connection);
                }
            }
        }
        LOG.info("Indexes are in place");
    }

    private static void rollbackQuietly (Connection connection) {
        if (connection == null) return;
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed: {}", e.getMessage());
        }
    }

}
