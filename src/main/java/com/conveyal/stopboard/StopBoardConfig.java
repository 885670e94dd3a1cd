package com.conveyal.stopboard;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;

/**
 * Settings for the database, the feed downloads and the live arrivals page, read from a YAML file. Every value has a
 * default, so a file only needs to name what differs.
 *
 * An instance is handed to the components that need it at construction time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StopBoardConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StopBoardConfig.class);

    /** Name of the configuration resource read when no file is given. */
    public static final String DEFAULT_RESOURCE = "stopboard.yml";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Database database = new Database();
    public Feeds feeds = new Feeds();
    public Live live = new Live();
    @JsonProperty("import")
    public Import importSettings = new Import();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Database {
        public String url = "jdbc:postgresql://localhost/stopboard";
        public String user;
        public String password;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feeds {
        /** Downloaded archives are stored here as {@code <city>.zip}. */
        public String directory = "gtfs_data";
        public int downloadTimeoutSeconds = 60;
        public int maxConcurrentDownloads = 4;
        public String userAgent = "StopBoard/1.0";
        /** City id to archive URL, in the order cities are processed. */
        public LinkedHashMap<String, String> cities = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Live {
        public String baseUrl = "https://motionbuscard.org.cy/routes/stop";
        public int timeoutSeconds = 10;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Import {
        public int batchSize = 500;
    }

    public static StopBoardConfig load (File file) throws IOException {
        LOG.info("Reading configuration from {}", file);
        return yamlMapper.readValue(file, StopBoardConfig.class);
    }

    public static StopBoardConfig load (InputStream inputStream) throws IOException {
        return yamlMapper.readValue(inputStream, StopBoardConfig.class);
    }

    /**
     * Read the configuration bundled on the classpath.
     */
    public static StopBoardConfig loadDefault () throws IOException {
        try (InputStream stream = StopBoardConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) throw new FileNotFoundException("Resource not found on classpath: " + DEFAULT_RESOURCE);
            return load(stream);
        }
    }

}
