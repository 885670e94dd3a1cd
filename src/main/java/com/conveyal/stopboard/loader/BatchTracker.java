package com.conveyal.stopboard.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Automatically push execute batches of prepared statements before the batch gets too big.
 * When constructed with commitEachBatch, every executed batch is also committed so that it survives a failure later
 * in the same table.
 */
public class BatchTracker {
    private static final Logger LOG = LoggerFactory.getLogger(BatchTracker.class);

    private final String recordType;
    private final Connection connection;
    private final int batchSize;
    private final boolean commitEachBatch;
    private PreparedStatement preparedStatement;
    private int currentBatchSize = 0;
    private int totalRecordsProcessed = 0;
    private int batchesCommitted = 0;

    public BatchTracker(
        String recordType,
        Connection connection,
        PreparedStatement preparedStatement,
        int batchSize,
        boolean commitEachBatch
    ) {
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be positive");
        this.recordType = recordType;
        this.connection = connection;
        this.preparedStatement = preparedStatement;
        this.batchSize = batchSize;
        this.commitEachBatch = commitEachBatch;
    }

    public void addBatch() throws SQLException {
        preparedStatement.addBatch();
        currentBatchSize += 1;
        if (currentBatchSize >= batchSize) {
            flush();
        }
    }

    private void flush () throws SQLException {
        preparedStatement.executeBatch();
        totalRecordsProcessed += currentBatchSize;
        currentBatchSize = 0;
        if (commitEachBatch) {
            connection.commit();
            batchesCommitted += 1;
            LOG.debug("Committed batch {} of {} records ({} so far)", batchesCommitted, recordType, totalRecordsProcessed);
        }
    }

    /**
     * Execute any remaining statements and return the total records processed.
     */
    public int executeRemaining() throws SQLException {
        if (currentBatchSize > 0) {
            flush();
        }
        // Avoid reuse, signal that this was cleanly closed.
        preparedStatement = null;
        LOG.info("Processed {} {} records", totalRecordsProcessed, recordType);
        return totalRecordsProcessed;
    }

    public int getBatchesCommitted () {
        return batchesCommitted;
    }
}
