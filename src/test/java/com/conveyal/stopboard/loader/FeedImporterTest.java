package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.TestUtils;
import com.conveyal.stopboard.stats.FeedStats;
import com.conveyal.stopboard.storage.StorageException;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.SQLException;
import java.util.Map;

import static com.conveyal.stopboard.TestUtils.queryInt;
import static com.conveyal.stopboard.TestUtils.queryString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FeedImporterTest {

    private DataSource dataSource;
    private FeedImporter importer;

    @BeforeEach
    public void setUp() throws IOException {
        dataSource = TestUtils.createTestDataSource();
        importer = new FeedImporter(dataSource);
    }

    @Test
    public void canImportFeed() throws IOException {
        File archive = TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED);
        FeedLoadResult result = importer.importFeed("limassol", archive);
        assertThat(result.success, equalTo(true));
        assertThat(result.city, equalTo("limassol"));
        Map<String, Integer> rowCounts = result.getRowCounts();
        assertThat(rowCounts.get("agency"), equalTo(1));
        assertThat(rowCounts.get("stops"), equalTo(6));
        assertThat(rowCounts.get("routes"), equalTo(3));
        assertThat(rowCounts.get("calendar"), equalTo(1));
        assertThat(rowCounts.get("calendar_dates"), equalTo(3));
        assertThat(rowCounts.get("trips"), equalTo(3));
        assertThat(rowCounts.get("stop_times"), equalTo(7));
        assertThat(rowCounts.get("shapes"), equalTo(3));
        assertThat(rowCounts.get("fare_attributes"), equalTo(1));
        assertThat(rowCounts.get("fare_rules"), equalTo(2));
        // Two bad stops, one bad stop time and one bad shape point.
        assertThat(result.tables.get("stops").skippedCount, equalTo(2));
        assertThat(result.tables.get("stop_times").skippedCount, equalTo(1));
        assertThat(result.tables.get("shapes").skippedCount, equalTo(1));
        assertThat(result.getSkippedCount(), equalTo(4));
    }

    @Test
    public void reimportIsIdempotent() throws IOException {
        File archive = TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED);
        importer.importFeed("limassol", archive);
        Map<String, Integer> firstCounts = new FeedStats(dataSource).getRowCounts();
        FeedLoadResult second = importer.importFeed("limassol", archive);
        assertThat(second.success, equalTo(true));
        assertThat(new FeedStats(dataSource).getRowCounts(), equalTo(firstCounts));
        assertThat(firstCounts.get("agency"), equalTo(1));
        assertThat(firstCounts.get("calendar"), equalTo(2));
    }

    @Test
    public void missingCalendarIsSynthesizedOnce() throws IOException, SQLException {
        importer.importFeed("limassol", TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED));
        assertThat(queryInt(dataSource, "select count(*) from calendar where service_id = 'HOLIDAY'"), equalTo(1));
        assertThat(queryInt(dataSource,
            "select monday + tuesday + wednesday + thursday + friday + saturday + sunday " +
                "from calendar where service_id = 'HOLIDAY'"), equalTo(0));
        assertThat(queryInt(dataSource, "select start_date from calendar where service_id = 'HOLIDAY'"),
            equalTo(Table.PLACEHOLDER_START_DATE));
        assertThat(queryInt(dataSource, "select end_date from calendar where service_id = 'HOLIDAY'"),
            equalTo(Table.PLACEHOLDER_END_DATE));
        // The real calendar row is not replaced by a placeholder.
        assertThat(queryInt(dataSource, "select monday from calendar where service_id = 'WEEKDAY'"), equalTo(1));
        assertThat(queryInt(dataSource, "select count(*) from calendar_dates where service_id = 'HOLIDAY'"),
            equalTo(2));
    }

    @Test
    public void collectsDistinctCalendarDateServiceIds() throws IOException {
        File archive = TestUtils.zipEntries(ImmutableMap.of(
            "calendar_dates.txt",
            "service_id,date,exception_type\n" +
                "HOLIDAY,20241225,1\n" +
                "WEEKDAY,20241225,2\n" +
                ",20241226,1\n" +
                "HOLIDAY,20241226,1\n"
        ));
        try (FeedArchiveReader reader = FeedArchiveReader.open(archive)) {
            assertThat(FeedImporter.collectServiceIds(reader), contains("HOLIDAY", "WEEKDAY"));
        }
        try (FeedArchiveReader reader = FeedArchiveReader.open(TestUtils.zipEntries(ImmutableMap.of(
            "stops.txt", "stop_id,stop_name\nA,Germasogeia\n")))) {
            assertThat(FeedImporter.collectServiceIds(reader), empty());
        }
    }

    @Test
    public void stopCoordinatesAreBothPresentOrBothNull() throws IOException, SQLException {
        importer.importFeed("limassol", TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED));
        assertThat(queryInt(dataSource,
            "select count(*) from stops where (stop_lat is null) <> (stop_lon is null)"), equalTo(0));
        assertThat(queryInt(dataSource, "select count(*) from stops where stop_lat = 0 or stop_lon = 0"), equalTo(0));
        assertThat(queryString(dataSource, "select stop_lat from stops where stop_id = '1006'"), nullValue());
        assertThat(queryString(dataSource, "select stop_lat from stops where stop_id = '1005'"), nullValue());
        // Half positions and unparseable positions are not stored at all.
        assertThat(queryInt(dataSource, "select count(*) from stops where stop_id in ('1007', '1008')"), equalTo(0));
    }

    @Test
    public void optionalValuesGetDefaults() throws IOException, SQLException {
        importer.importFeed("limassol", TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED));
        assertThat(queryInt(dataSource, "select location_type from stops where stop_id = '1004'"), equalTo(0));
        assertThat(queryInt(dataSource, "select timepoint from stop_times where trip_id = 'T1' and stop_sequence = 1"),
            equalTo(1));
        assertThat(queryString(dataSource, "select route_color from routes where route_id = 'RA1'"), nullValue());
        assertThat(queryString(dataSource, "select arrival_time from stop_times where trip_id = 'T2' and stop_sequence = 1"),
            equalTo("24:10:00"));
        assertThat(queryString(dataSource, "select route_id from fare_rules where fare_id = 'F1' and route_id = ''"),
            equalTo(""));
    }

    @Test
    public void reimportMergesOnlyAuthoritativeColumns() throws IOException, SQLException {
        importer.importFeed("limassol", TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED));
        File update = TestUtils.zipEntries(ImmutableMap.of(
            "agency.txt",
            "agency_id,agency_name,agency_url,agency_timezone,agency_lang\n" +
                "EMEL,EMEL Limassol,https://www.emel.com.cy,Asia/Nicosia,en\n",
            "stops.txt",
            "stop_id,stop_code,stop_name,stop_lat,stop_lon\n" +
                "1001,X1001,Agios Nikolaos Square,34.6850,33.0380\n",
            "routes.txt",
            "route_id,agency_id,route_short_name,route_long_name,route_type,route_color\n" +
                "R30,EMEL,30,Agios Nikolaos - Old Port via Molos,3,FF0000\n"
        ));
        FeedLoadResult result = importer.importFeed("limassol", update);
        assertThat(result.success, equalTo(true));

        // Agency is insert-only.
        assertThat(queryString(dataSource, "select agency_timezone from agency where agency_id = 'EMEL'"),
            equalTo("Europe/Nicosia"));
        assertThat(queryString(dataSource, "select agency_name from agency where agency_id = 'EMEL'"),
            equalTo("Limassol Buses"));
        // Stops take the new name and position, but keep their code.
        assertThat(queryString(dataSource, "select stop_name from stops where stop_id = '1001'"),
            equalTo("Agios Nikolaos Square"));
        assertThat(queryInt(dataSource,
            "select count(*) from stops where stop_id = '1001' and stop_lat > 34.6845 and stop_lat < 34.6855"),
            equalTo(1));
        assertThat(queryString(dataSource, "select stop_code from stops where stop_id = '1001'"), equalTo("1001"));
        // Routes take the new long name, but keep their color.
        assertThat(queryString(dataSource, "select route_long_name from routes where route_id = 'R30'"),
            equalTo("Agios Nikolaos - Old Port via Molos"));
        assertThat(queryString(dataSource, "select route_color from routes where route_id = 'R30'"),
            equalTo("1E90FF"));
        // Nothing else changed.
        assertThat(queryInt(dataSource, "select count(*) from stops"), equalTo(6));
    }

    @Test
    public void committedBatchesSurviveLaterFailure() throws IOException, SQLException {
        FeedImporter smallBatches = new FeedImporter(dataSource, 2);
        File archive = TestUtils.zipEntries(ImmutableMap.of(
            "stops.txt", "stop_id,stop_name\nA,Germasogeia\n",
            "calendar.txt",
            "service_id,monday,tuesday,wednesday,thursday,friday,saturday,sunday,start_date,end_date\n" +
                "DAILY,1,1,1,1,1,1,1,20240101,20241231\n",
            "trips.txt", "route_id,service_id,trip_id\nR1,DAILY,T1\n",
            "stop_times.txt",
            "trip_id,arrival_time,departure_time,stop_id,stop_sequence\n" +
                "T1,07:00:00,07:00:00,A,1\n" +
                "T1,07:05:00,07:05:00,A,2\n" +
                "T1,07:10:00,07:10:00,A,3\n" +
                "T1,07:15:00,07:15:00,A,4\n" +
                "T1,07:20:00,07:20:00,MISSING,5\n"
        ));
        assertThrows(StorageException.class, () -> smallBatches.importFeed("ayia_napa", archive));
        assertThat(queryInt(dataSource, "select count(*) from stop_times"), equalTo(4));
        assertThat(queryInt(dataSource, "select count(*) from stops"), equalTo(1));
    }

    @Test
    public void corruptArchiveFailsCity() throws IOException {
        File corrupt = File.createTempFile("corrupt-", ".zip");
        corrupt.deleteOnExit();
        Files.write(corrupt.toPath(), "PK but not really".getBytes(StandardCharsets.UTF_8));
        StorageException e = assertThrows(StorageException.class, () -> importer.importFeed("paralimni", corrupt));
        assertThat(e.getMessage(), equalTo("Import of paralimni failed"));
    }

    @Test
    public void emptyArchiveImportsNothing() throws IOException {
        File archive = TestUtils.zipEntries(ImmutableMap.of("readme.txt", "no feed here"));
        FeedLoadResult result = importer.importFeed("empty", archive);
        assertThat(result.success, equalTo(true));
        assertThat(result.getRowCounts().get("stops"), equalTo(0));
    }

    @Test
    public void indexesAreCreatedAfterImport() throws IOException, SQLException {
        importer.importFeed("limassol", TestUtils.zipFolderFiles(TestUtils.FAKE_CYPRUS_FEED));
        for (String index : new String[] {
            "idx_stops_stop_name", "idx_stops_stop_lat_stop_lon", "idx_routes_route_short_name",
            "idx_stop_times_stop_id", "idx_stop_times_arrival_time", "idx_shapes_shape_id"
        }) {
            assertThat(index, queryInt(dataSource,
                "select count(*) from sqlite_master where type = 'index' and name = '" + index + "'"), equalTo(1));
        }
    }

    @Test
    public void batchSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FeedImporter(dataSource, 0));
    }

}
