package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static com.conveyal.stopboard.loader.Requirement.OPTIONAL;
import static com.conveyal.stopboard.loader.Requirement.REQUIRED;

/**
 * This groups a table name with a description of the fields in the table. It can be normative (expressing the
 * specification for a GTFS table) and also describes the SQL table the importer writes into: its primary key,
 * foreign keys, the {@link MergePolicy} applied when a row is imported again, and the indexes built after a load.
 */
public class Table {

    private static final Logger LOG = LoggerFactory.getLogger(Table.class);

    /** Placeholder calendar rows span this range so that any service date in practice falls inside it. */
    public static final int PLACEHOLDER_START_DATE = 20200101;
    public static final int PLACEHOLDER_END_DATE = 20991231;

    public final String name;

    public final String fileName;

    public final Field[] fields;

    private List<String> primaryKey;

    private MergePolicy mergePolicy = MergePolicy.insertOnly();

    /** Large tables are committed every batch so that partial progress survives a failure later in the file. */
    private boolean batched = false;

    private final List<String[]> indexColumns = new ArrayList<>();

    private UnaryOperator<Map<String, String>> rowNormalizer = UnaryOperator.identity();

    public Table (String name, Field... fields) {
        this.name = name;
        this.fileName = name + ".txt";
        this.fields = fields;
        // By default the first field is the key, as in most GTFS tables.
        this.primaryKey = ImmutableList.of(fields[0].name);
    }

    public static final Table AGENCY = new Table("agency",
        new StringField("agency_id", REQUIRED).permitEmptyValue(),
        new StringField("agency_name", OPTIONAL).withDefault(""),
        new StringField("agency_url", OPTIONAL).withDefault(""),
        new StringField("agency_timezone", OPTIONAL).withDefault("Europe/Nicosia"),
        new StringField("agency_lang", OPTIONAL).withDefault("el")
    ).mergePolicy(MergePolicy.insertOnly());

    public static final Table STOPS = new Table("stops",
        new StringField("stop_id", REQUIRED),
        new StringField("stop_code", OPTIONAL),
        new StringField("stop_name", OPTIONAL).withDefault(""),
        new StringField("stop_desc", OPTIONAL),
        new DoubleField("stop_lat", OPTIONAL, -90, 90).strict(),
        new DoubleField("stop_lon", OPTIONAL, -180, 180).strict(),
        new StringField("zone_id", OPTIONAL),
        new StringField("stop_url", OPTIONAL),
        new IntegerField("location_type", OPTIONAL, 4).withDefault("0"),
        new StringField("parent_station", OPTIONAL),
        new IntegerField("wheelchair_boarding", OPTIONAL, 2).withDefault("0")
    ).mergePolicy(MergePolicy.overwrite("stop_name", "stop_lat", "stop_lon"))
     .normalizeRows(Table::normalizeCoordinates)
     .index("stop_name")
     .index("stop_lat", "stop_lon");

    public static final Table ROUTES = new Table("routes",
        new StringField("route_id", REQUIRED),
        new StringField("agency_id", OPTIONAL).isReferenceTo(AGENCY),
        new StringField("route_short_name", OPTIONAL).withDefault(""),
        new StringField("route_long_name", OPTIONAL).withDefault(""),
        new StringField("route_desc", OPTIONAL),
        new IntegerField("route_type", OPTIONAL, 1700).withDefault("3"),
        new StringField("route_color", OPTIONAL),
        new StringField("route_text_color", OPTIONAL),
        new IntegerField("route_sort_order", OPTIONAL)
    ).mergePolicy(MergePolicy.overwrite("route_short_name", "route_long_name", "route_type"))
     .index("route_short_name");

    public static final Table CALENDAR = new Table("calendar",
        new StringField("service_id", REQUIRED),
        new IntegerField("monday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("tuesday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("wednesday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("thursday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("friday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("saturday", OPTIONAL, 0, 1).withDefault("0"),
        new IntegerField("sunday", OPTIONAL, 0, 1).withDefault("0"),
        new DateField("start_date", REQUIRED),
        new DateField("end_date", REQUIRED)
    ).mergePolicy(MergePolicy.insertOnly());

    public static final Table CALENDAR_DATES = new Table("calendar_dates",
        new StringField("service_id", REQUIRED).isReferenceTo(CALENDAR),
        new DateField("date", REQUIRED),
        new IntegerField("exception_type", OPTIONAL, 1, 2).withDefault("1")
    ).primaryKey("service_id", "date")
     .mergePolicy(MergePolicy.insertOnly());

    public static final Table TRIPS = new Table("trips",
        new StringField("trip_id", REQUIRED),
        new StringField("route_id", REQUIRED),
        new StringField("service_id", REQUIRED).isReferenceTo(CALENDAR),
        new StringField("trip_headsign", OPTIONAL).withDefault(""),
        new StringField("trip_short_name", OPTIONAL),
        new IntegerField("direction_id", OPTIONAL, 1),
        new StringField("block_id", OPTIONAL),
        new StringField("shape_id", OPTIONAL),
        new IntegerField("wheelchair_accessible", OPTIONAL, 2).withDefault("0"),
        new IntegerField("bikes_allowed", OPTIONAL, 2).withDefault("0")
    ).mergePolicy(MergePolicy.overwrite("route_id", "service_id"))
     .index("route_id")
     .index("service_id");

    public static final Table STOP_TIMES = new Table("stop_times",
        new StringField("trip_id", REQUIRED).isReferenceTo(TRIPS),
        new IntegerField("stop_sequence", REQUIRED),
        new TimeField("arrival_time", OPTIONAL),
        new TimeField("departure_time", OPTIONAL),
        new StringField("stop_id", REQUIRED).isReferenceTo(STOPS),
        new StringField("stop_headsign", OPTIONAL),
        new IntegerField("pickup_type", OPTIONAL, 3).withDefault("0"),
        new IntegerField("drop_off_type", OPTIONAL, 3).withDefault("0"),
        new DoubleField("shape_dist_traveled", OPTIONAL, 0, Double.POSITIVE_INFINITY),
        new IntegerField("timepoint", OPTIONAL, 1).withDefault("1")
    ).primaryKey("trip_id", "stop_sequence")
     .mergePolicy(MergePolicy.insertOnly())
     .batched()
     .index("stop_id")
     .index("trip_id")
     .index("arrival_time");

    public static final Table SHAPES = new Table("shapes",
        new StringField("shape_id", REQUIRED),
        new IntegerField("shape_pt_sequence", REQUIRED),
        new DoubleField("shape_pt_lat", REQUIRED, -90, 90),
        new DoubleField("shape_pt_lon", REQUIRED, -180, 180),
        new DoubleField("shape_dist_traveled", OPTIONAL, 0, Double.POSITIVE_INFINITY)
    ).primaryKey("shape_id", "shape_pt_sequence")
     .mergePolicy(MergePolicy.insertOnly())
     .batched()
     .index("shape_id");

    public static final Table FARE_ATTRIBUTES = new Table("fare_attributes",
        new StringField("fare_id", REQUIRED),
        new DoubleField("price", REQUIRED, 0.0, Double.MAX_VALUE),
        new StringField("currency_type", OPTIONAL).withDefault("EUR"),
        new IntegerField("payment_method", OPTIONAL, 1).withDefault("0"),
        new IntegerField("transfers", OPTIONAL, 2),
        new StringField("agency_id", OPTIONAL),
        new IntegerField("transfer_duration", OPTIONAL)
    ).mergePolicy(MergePolicy.overwrite("price", "currency_type", "payment_method", "transfers", "transfer_duration"));

    public static final Table FARE_RULES = new Table("fare_rules",
        new StringField("fare_id", REQUIRED).isReferenceTo(FARE_ATTRIBUTES),
        new StringField("route_id", REQUIRED).permitEmptyValue(),
        new StringField("origin_id", OPTIONAL),
        new StringField("destination_id", OPTIONAL)
    ).primaryKey("fare_id", "route_id")
     .mergePolicy(MergePolicy.overwrite("origin_id", "destination_id"));

    /**
     * Tables in the order they must be loaded. Every table comes after the tables it references.
     */
    public static final List<Table> IMPORT_ORDER = ImmutableList.of(
        AGENCY, STOPS, ROUTES, CALENDAR, CALENDAR_DATES, TRIPS, STOP_TIMES, SHAPES, FARE_ATTRIBUTES, FARE_RULES
    );

    /** Fluent method to declare a primary key other than the first field. */
    public Table primaryKey (String... columns) {
        this.primaryKey = ImmutableList.copyOf(columns);
        return this;
    }

    /** Fluent method to set how rows colliding with an existing key are merged. */
    public Table mergePolicy (MergePolicy mergePolicy) {
        for (String column : mergePolicy.getOverwrittenColumns()) {
            if (getFieldForName(column) == null) {
                throw new IllegalArgumentException(String.format("Table %s has no column %s", name, column));
            }
        }
        this.mergePolicy = mergePolicy;
        return this;
    }

    /** Fluent method to commit this table's rows in fixed-size batches. */
    public Table batched () {
        this.batched = true;
        return this;
    }

    /** Fluent method to register a secondary index built after the feed has been loaded. */
    public Table index (String... columns) {
        this.indexColumns.add(columns);
        return this;
    }

    /** Fluent method to register a cross-field check or rewrite applied to each raw CSV row before binding. */
    public Table normalizeRows (UnaryOperator<Map<String, String>> rowNormalizer) {
        this.rowNormalizer = rowNormalizer;
        return this;
    }

    public List<String> getPrimaryKey () {
        return primaryKey;
    }

    public MergePolicy getMergePolicy () {
        return mergePolicy;
    }

    public boolean isBatched () {
        return batched;
    }

    public Field getFieldForName(String fieldName) {
        int index = Field.getFieldIndex(fields, fieldName);
        return index >= 0 ? fields[index] : null;
    }

    /**
     * Create the SQL table with all the fields specified by this table object, its primary key and any foreign keys,
     * unless it already exists. The connection is not committed.
     */
    public void createSqlTable (Connection connection) throws SQLException {
        List<String> declarations = Arrays.stream(fields)
            .map(Field::getSqlDeclaration)
            .collect(Collectors.toList());
        declarations.add(String.format("primary key (%s)", String.join(", ", primaryKey)));
        for (Field field : fields) {
            if (field.isForeignReference()) {
                declarations.add(String.format(
                    "foreign key (%s) references %s (%s)",
                    field.name,
                    field.referenceTable.name,
                    field.referenceTable.primaryKey.get(0)
                ));
            }
        }
        String createSql = String.format("create table if not exists %s (%s)", name, String.join(", ", declarations));
        LOG.debug(createSql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(createSql);
        }
    }

    /**
     * Create SQL string for use in an insert statement whose conflict behavior follows this table's merge policy.
     * Parameters are in field order.
     */
    public String generateUpsertSql () {
        String columns = Arrays.stream(fields).map(f -> f.name).collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(fields.length, "?"));
        return String.format(
            "insert into %s (%s) values (%s) %s",
            name,
            columns,
            placeholders,
            mergePolicy.conflictClause(primaryKey)
        );
    }

    /**
     * @return one "create index if not exists" statement per index registered on this table.
     */
    public List<String> getIndexSql () {
        List<String> statements = new ArrayList<>();
        for (String[] columns : indexColumns) {
            // Note: SQLITE requires specifying a name for indexes.
            String indexName = String.join("_", "idx", name, String.join("_", columns));
            statements.add(String.format(
                "create index if not exists %s on %s (%s)", indexName, name, String.join(", ", columns)
            ));
        }
        return statements;
    }

    /**
     * Bind the values of one CSV row to the parameters of a statement created from {@link #generateUpsertSql()}.
     * Columns missing from the CSV file are treated as empty values.
     *
     * @throws ValueParseException if the row must be skipped
     */
    public void setStatementParameters (PreparedStatement statement, Map<String, String> row) throws SQLException {
        Map<String, String> normalized = rowNormalizer.apply(row);
        for (int i = 0; i < fields.length; i++) {
            fields[i].setParameter(statement, i + 1, normalized.get(fields[i].name));
        }
    }

    /**
     * A stop has either both coordinates, non-zero, or none. A row with only one coordinate is rejected, and a
     * zero coordinate is treated as absent so that it cannot be mistaken for a real position.
     */
    static Map<String, String> normalizeCoordinates (Map<String, String> row) {
        String lat = trimToEmpty(row.get("stop_lat"));
        String lon = trimToEmpty(row.get("stop_lon"));
        if (lat.isEmpty() && lon.isEmpty()) return row;
        if (lat.isEmpty() || lon.isEmpty()) {
            throw new ValueParseException("Stop has only one coordinate", lat + "," + lon);
        }
        Field latField = STOPS.getFieldForName("stop_lat");
        Field lonField = STOPS.getFieldForName("stop_lon");
        double latValue = ((DoubleField) latField).validate(lat);
        double lonValue = ((DoubleField) lonField).validate(lon);
        if (latValue != 0 && lonValue != 0) return row;
        Map<String, String> copy = new LinkedHashMap<>(row);
        copy.put("stop_lat", "");
        copy.put("stop_lon", "");
        return copy;
    }

    private static String trimToEmpty (String string) {
        return string == null ? "" : string.trim();
    }

    @Override
    public String toString () {
        return name;
    }

}
