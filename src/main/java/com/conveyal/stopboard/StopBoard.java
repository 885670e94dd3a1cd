package com.conveyal.stopboard;

import com.conveyal.stopboard.error.ArchiveNotFoundException;
import com.conveyal.stopboard.error.FetchException;
import com.conveyal.stopboard.error.UnknownCityException;
import com.conveyal.stopboard.fetch.FeedFetcher;
import com.conveyal.stopboard.fetch.FetchResult;
import com.conveyal.stopboard.loader.FeedImporter;
import com.conveyal.stopboard.loader.FeedLoadResult;
import com.conveyal.stopboard.model.Arrival;
import com.conveyal.stopboard.model.LiveArrival;
import com.conveyal.stopboard.model.RouteAtStop;
import com.conveyal.stopboard.model.StopArrivals;
import com.conveyal.stopboard.model.StopInfo;
import com.conveyal.stopboard.model.SyncResult;
import com.conveyal.stopboard.realtime.ArrivalFusion;
import com.conveyal.stopboard.realtime.LiveArrivalFetcher;
import com.conveyal.stopboard.stats.FeedStats;
import com.conveyal.stopboard.storage.StopRepository;
import com.conveyal.stopboard.storage.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.dbcp2.ConnectionFactory;
import org.apache.commons.dbcp2.DriverManagerConnectionFactory;
import org.apache.commons.dbcp2.PoolableConnection;
import org.apache.commons.dbcp2.PoolableConnectionFactory;
import org.apache.commons.dbcp2.PoolingDataSource;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This is the public interface to the stop board core: feed download and import, stats, and the per-stop arrival
 * board. Callers such as a web layer should only use the core through the methods of this class and the types in the
 * model package.
 */
public class StopBoard {

    private static final Logger LOG = LoggerFactory.getLogger(StopBoard.class);

    private final FeedFetcher feedFetcher;
    private final FeedImporter feedImporter;
    private final FeedStats feedStats;
    private final StopRepository stopRepository;
    private final LiveArrivalFetcher liveArrivalFetcher;

    public StopBoard (StopBoardConfig config, DataSource dataSource) {
        this(config, dataSource, Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for live arrival predictions
     */
    public StopBoard (StopBoardConfig config, DataSource dataSource, Clock clock) {
        this.feedFetcher = new FeedFetcher(config.feeds);
        this.feedImporter = new FeedImporter(dataSource, config.importSettings.batchSize);
        this.feedStats = new FeedStats(dataSource);
        this.stopRepository = new StopRepository(dataSource);
        this.liveArrivalFetcher = new LiveArrivalFetcher(config.live, clock);
    }

    /**
     * @return the ids of all configured cities, in configuration order.
     */
    public List<String> listCities () {
        return feedFetcher.listCities();
    }

    /**
     * Download the feed archive of one city, or of all cities when given null or "all".
     * @throws UnknownCityException if a specific city is not configured. No download is attempted.
     */
    public Map<String, FetchResult> downloadFeed (String cityOrAll) throws UnknownCityException {
        return feedFetcher.download(cityOrAll);
    }

    /**
     * Import previously downloaded archives. Cities are imported one after the other, and a failure (including a
     * configured city id that cannot name an archive) is reported in that city's result without affecting cities
     * imported before or after it. When importing all cities, those without a downloaded archive are left out.
     *
     * @throws UnknownCityException     if a specific city is not configured
     * @throws ArchiveNotFoundException if a specific city was requested and its archive has not been downloaded
     */
    public Map<String, FeedLoadResult> importFeed (String cityOrAll)
        throws UnknownCityException, ArchiveNotFoundException {
        List<String> cities = feedFetcher.resolveCities(cityOrAll);
        boolean specificCity = cities.size() == 1 && cities.get(0).equals(cityOrAll);
        Map<String, FeedLoadResult> results = new LinkedHashMap<>();
        for (String city : cities) {
            File archive;
            try {
                archive = feedFetcher.archiveFor(city);
            } catch (IllegalStateException e) {
                LOG.error("Cannot import {}: {}", city, e.getMessage());
                results.put(city, FeedLoadResult.failure(city, null, e.getMessage()));
                continue;
            }
            if (!archive.isFile()) {
                if (specificCity) throw new ArchiveNotFoundException(archive);
                LOG.info("No downloaded archive for {}, skipping", city);
                continue;
            }
            FeedLoadResult result;
            try {
                result = feedImporter.importFeed(city, archive);
            } catch (StorageException e) {
                LOG.error("Import of {} failed: {}", city, e.badValue);
                result = FeedLoadResult.failure(city, archive.getName(), e.badValue);
            }
            results.put(city, result);
        }
        return results;
    }

    /**
     * Download then import.
     * @throws FetchException if not a single archive could be downloaded, in which case nothing is imported
     */
    public SyncResult syncFeed (String cityOrAll)
        throws UnknownCityException, ArchiveNotFoundException, FetchException {
        Map<String, FetchResult> downloads = downloadFeed(cityOrAll);
        long downloaded = downloads.values().stream().filter(r -> r.success).count();
        if (downloaded == 0) throw new FetchException("No GTFS files were downloaded");
        return new SyncResult(downloads, importFeed(cityOrAll));
    }

    /**
     * @return row counts per feed table.
     */
    public Map<String, Integer> stats () {
        return feedStats.getRowCounts();
    }

    /**
     * Build the arrival board for a stop from live predictions and the static routes serving it. A stop that is not
     * in the store gets a placeholder description and no routes, and its live arrivals are still shown.
     */
    public StopArrivals getArrivals (String stopId) {
        StopInfo stopInfo = null;
        try {
            stopInfo = stopRepository.getStop(stopId);
        } catch (StorageException e) {
            LOG.warn("Stop lookup failed, showing placeholder: {}", e.badValue);
        }
        List<RouteAtStop> routes = ImmutableList.of();
        if (stopInfo == null) {
            stopInfo = StopInfo.placeholder(stopId);
        } else {
            routes = stopRepository.getRoutesForStop(stopId);
        }
        List<LiveArrival> liveArrivals = liveArrivalFetcher.fetch(stopId);
        List<Arrival> arrivals = ArrivalFusion.enrich(liveArrivals, routes);
        return new StopArrivals(stopInfo, arrivals, routes);
    }

    public List<RouteAtStop> getRoutesForStop (String stopId) {
        return stopRepository.getRoutesForStop(stopId);
    }

    public static DataSource createDataSource (String url, String username, String password) {
        String characterEncoding = Charset.defaultCharset().toString();
        LOG.debug("Default character encoding: {}", characterEncoding);
        if (!Charset.defaultCharset().equals(StandardCharsets.UTF_8)) {
            // Greek route and stop names are mangled otherwise.
            throw new RuntimeException("Your system's default encoding (" + characterEncoding + ") is not supported. " +
                "Please set it to UTF-8. Example: java -Dfile.encoding=UTF-8 application.jar");
        }
        // ConnectionFactory can handle null username and password (for local host-based authentication)
        ConnectionFactory connectionFactory = new DriverManagerConnectionFactory(url, username, password);
        PoolableConnectionFactory poolableConnectionFactory = new PoolableConnectionFactory(connectionFactory, null);
        GenericObjectPool<PoolableConnection> connectionPool = new GenericObjectPool<>(poolableConnectionFactory);
        connectionPool.setMaxTotal(20);
        connectionPool.setMaxIdle(4);
        connectionPool.setMinIdle(1);
        poolableConnectionFactory.setPool(connectionPool);
        // Auto-commit is off for bulk inserts. The importer commits per table and per batch.
        poolableConnectionFactory.setDefaultAutoCommit(false);
        return new PoolingDataSource<>(connectionPool);
    }

    /**
     * A command-line interface to download and import feeds, print table statistics and show the arrival board of a
     * stop. Results are printed to standard out as JSON.
     */
    public static void main (String[] args) throws IOException {
        Options options = getOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            LOG.error("Error parsing command line", e);
            printHelp(options);
            return;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return;
        }

        if (!cmd.getArgList().isEmpty()) {
            LOG.error("Extraneous arguments present: {}", cmd.getArgs());
            printHelp(options);
            return;
        }

        if (!(cmd.hasOption("cities") || cmd.hasOption("download") || cmd.hasOption("import") ||
            cmd.hasOption("sync") || cmd.hasOption("stats") || cmd.hasOption("arrivals") ||
            cmd.hasOption("routes"))) {
            LOG.error("Must specify one of 'cities', 'download', 'import', 'sync', 'stats', 'arrivals' or 'routes'.");
            printHelp(options);
            return;
        }

        StopBoardConfig config = cmd.hasOption("config")
            ? StopBoardConfig.load(new File(cmd.getOptionValue("config")))
            : StopBoardConfig.loadDefault();
        String databaseUrl = cmd.getOptionValue("database", config.database.url);
        String databaseUser = cmd.getOptionValue("user", config.database.user);
        String databasePassword = cmd.getOptionValue("password", config.database.password);
        LOG.info("Connecting to {} as user {}", databaseUrl, databaseUser);

        // Create a JDBC connection pool for the specified database.
        // Missing (null) username and password will fall back on host-based authentication.
        DataSource dataSource = createDataSource(databaseUrl, databaseUser, databasePassword);
        StopBoard stopBoard = new StopBoard(config, dataSource);
        ObjectMapper mapper = new ObjectMapper();

        try {
            if (cmd.hasOption("cities")) {
                print(mapper, stopBoard.listCities());
            }
            if (cmd.hasOption("sync")) {
                print(mapper, stopBoard.syncFeed(cmd.getOptionValue("sync")));
            } else {
                if (cmd.hasOption("download")) {
                    print(mapper, stopBoard.downloadFeed(cmd.getOptionValue("download")));
                }
                if (cmd.hasOption("import")) {
                    print(mapper, stopBoard.importFeed(cmd.getOptionValue("import")));
                }
            }
            if (cmd.hasOption("stats")) {
                print(mapper, stopBoard.stats());
            }
            if (cmd.hasOption("arrivals")) {
                print(mapper, stopBoard.getArrivals(cmd.getOptionValue("arrivals")));
            }
            if (cmd.hasOption("routes")) {
                print(mapper, stopBoard.getRoutesForStop(cmd.getOptionValue("routes")));
            }
        } catch (UnknownCityException | ArchiveNotFoundException | FetchException e) {
            LOG.error(e.getMessage());
        }
    }

    private static void print (ObjectMapper mapper, Object result) throws IOException {
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    /**
     * The parameter to Option.builder is the short option. Use the no-arg builder constructor with .longOpt() to
     * specify an option that has no short form.
     */
    static Options getOptions () {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        options.addOption(Option.builder()
                .longOpt("config").hasArg()
                .argName("file")
                .desc("YAML configuration file. Defaults to the bundled " + StopBoardConfig.DEFAULT_RESOURCE).build());
        options.addOption(Option.builder()
                .longOpt("cities")
                .desc("list the configured cities").build());
        options.addOption(Option.builder()
                .longOpt("download").hasArg().optionalArg(true)
                .argName("city")
                .desc("download the feed of the given city, or of all cities").build());
        options.addOption(Option.builder()
                .longOpt("import").hasArg().optionalArg(true)
                .argName("city")
                .desc("import the downloaded feed of the given city, or of all downloaded cities").build());
        options.addOption(Option.builder()
                .longOpt("sync").hasArg().optionalArg(true)
                .argName("city")
                .desc("download then import the given city, or all cities").build());
        options.addOption(Option.builder()
                .longOpt("stats")
                .desc("print row counts per table").build());
        options.addOption(Option.builder()
                .longOpt("arrivals").hasArg()
                .argName("stopId")
                .desc("print the arrival board for a stop").build());
        options.addOption(Option.builder()
                .longOpt("routes").hasArg()
                .argName("stopId")
                .desc("print the routes serving a stop").build());
        options.addOption(Option.builder("d")
                .longOpt("database").hasArg()
                .argName("url")
                .desc("JDBC URL for the database. Defaults to the configured URL").build());
        options.addOption(Option.builder("u").longOpt("user").hasArg()
                .argName("username")
                .desc("database username").build());
        options.addOption(Option.builder("p")
                .longOpt("password").hasArg()
                .argName("password")
                .desc("database password").build());
        return options;
    }

    static void printHelp(Options options) {
        final String HELP = String.join("\n",
                "java -cp stopboard.jar com.conveyal.stopboard.StopBoard [options]",
                // blank lines for legibility
                "",
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        System.out.println(); // blank line for legibility
        formatter.printHelp(HELP, options);
        System.out.println(); // blank line for legibility
    }

}
