package com.conveyal.stopboard.loader;

import com.csvreader.CsvReader;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads GTFS tables out of a zipped feed, either streamed row by row or decoded into a list of rows. Each row maps the
 * CSV headers to the trimmed values in header order.
 *
 * A table that is absent from the archive yields no rows, since GTFS feeds legitimately omit optional tables.
 */
public class FeedArchiveReader implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FeedArchiveReader.class);

    private final File file;
    private final ZipFile zip;

    private FeedArchiveReader (File file, ZipFile zip) {
        this.file = file;
        this.zip = zip;
    }

    /**
     * Open the archive for reading.
     * @throws IOException if the file is missing or is not a readable zip archive
     */
    public static FeedArchiveReader open (File file) throws IOException {
        return new FeedArchiveReader(file, new ZipFile(file));
    }

    /**
     * Read one table from an archive without keeping it open. Any problem with the archive itself is logged and
     * results in an empty list.
     */
    public static List<Map<String, String>> readTable (File archive, String tableName) {
        try (FeedArchiveReader reader = open(archive)) {
            return reader.readTable(tableName);
        } catch (IOException e) {
            LOG.error("Could not open feed archive {}: {}", archive, e.toString());
            return ImmutableList.of();
        }
    }

    /**
     * Locate the zip entry for a table, first at the root of the archive and then in any subdirectory.
     * @return the entry, or null if the archive does not contain the table
     */
    public ZipEntry findEntry (String tableName) {
        String tableFileName = toFileName(tableName);
        ZipEntry entry = zip.getEntry(tableFileName);
        if (entry != null) return entry;
        // Table was not found, check if it is in a subdirectory.
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry e = entries.nextElement();
            if (!e.isDirectory() && e.getName().endsWith("/" + tableFileName)) {
                LOG.info("Table {} found in subdirectory: {}", tableFileName, e.getName());
                return e;
            }
        }
        return null;
    }

    /**
     * @return the uncompressed size in bytes of the table, or 0 if it is absent or the size is unknown.
     */
    public long getTableSize (String tableName) {
        ZipEntry entry = findEntry(tableName);
        if (entry == null || entry.getSize() < 0) return 0;
        return entry.getSize();
    }

    /**
     * Open a table for streaming. Rows are decoded one at a time, so a table of any size can be processed without
     * holding it in memory.
     *
     * @param tableName the table name, with or without the .txt extension
     * @return the open table, or null if the archive does not contain it
     * @throws IOException if the entry cannot be read or its header cannot be decoded
     */
    public TableRows openTable (String tableName) throws IOException {
        ZipEntry entry = findEntry(tableName);
        if (entry == null) {
            LOG.info("File {} not found in gtfs zipfile {}", toFileName(tableName), file.getName());
            return null;
        }
        return new TableRows(entry.getName(), zip.getInputStream(entry));
    }

    /**
     * Decode a whole table into rows. Decoding errors are logged and the rows read so far are discarded, so that
     * callers can carry on with the remaining tables. Large tables should be read with {@link #openTable(String)}.
     *
     * @param tableName the table name, with or without the .txt extension
     */
    public List<Map<String, String>> readTable (String tableName) {
        List<Map<String, String>> rows = new ArrayList<>();
        try (TableRows tableRows = openTable(tableName)) {
            if (tableRows == null) return ImmutableList.of();
            for (Map<String, String> row = tableRows.next(); row != null; row = tableRows.next()) {
                rows.add(row);
            }
            return rows;
        } catch (IOException e) {
            LOG.error("Exception while reading {} from {}: {}", toFileName(tableName), file.getName(), e.toString());
            return ImmutableList.of();
        }
    }

    /**
     * One table of the archive, read record by record. Each row maps the trimmed CSV headers to the trimmed values
     * in header order.
     */
    public static class TableRows implements Closeable {

        private final String entryName;
        private final CsvReader csvReader;
        private final String[] headers;
        /** Line of the most recently returned row, counting the header as line 1. */
        private long lineNumber = 1;

        private TableRows (String entryName, InputStream inputStream) throws IOException {
            this.entryName = entryName;
            // Skip any byte order mark that may be present. Files must be UTF-8,
            // but the GTFS spec says that "files that include the UTF byte order mark are acceptable".
            InputStream bomInputStream = new BOMInputStream(inputStream);
            this.csvReader = new CsvReader(bomInputStream, ',', StandardCharsets.UTF_8);
            String[] headerRow;
            try {
                headerRow = csvReader.readHeaders() ? csvReader.getHeaders() : new String[0];
            } catch (IOException e) {
                csvReader.close();
                throw e;
            }
            for (int i = 0; i < headerRow.length; i++) headerRow[i] = headerRow[i].trim();
            this.headers = headerRow;
        }

        /**
         * @return the next row, or null once the table is exhausted
         */
        public Map<String, String> next () throws IOException {
            if (headers.length == 0 || !csvReader.readRecord()) return null;
            lineNumber += 1;
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.length; i++) {
                // Short records yield empty strings for their missing trailing columns.
                row.put(headers[i], csvReader.get(i).trim());
            }
            return row;
        }

        public long getLineNumber () {
            return lineNumber;
        }

        public String getEntryName () {
            return entryName;
        }

        @Override
        public void close () {
            csvReader.close();
        }

    }

    private static String toFileName (String tableName) {
        return tableName.endsWith(".txt") ? tableName : tableName + ".txt";
    }

    @Override
    public void close () throws IOException {
        zip.close();
    }

}
