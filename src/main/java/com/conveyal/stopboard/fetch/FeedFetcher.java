package com.conveyal.stopboard.fetch;

import com.conveyal.stopboard.StopBoardConfig;
import com.conveyal.stopboard.error.UnknownCityException;
import com.conveyal.stopboard.util.Util;
import com.google.common.collect.ImmutableList;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.conveyal.stopboard.util.Util.human;

/**
 * Downloads city feed archives from the URLs in the configuration.
 *
 * Each city is downloaded on a fixed-size worker pool, with a single attempt bounded by the configured timeout. The
 * archive is first written to a temporary file in the feeds directory and only replaces {@code <city>.zip} once
 * complete, so a failed download leaves any previously downloaded archive in place.
 */
public class FeedFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(FeedFetcher.class);

    /** Selects every configured city. */
    public static final String ALL_CITIES = "all";

    private final StopBoardConfig.Feeds feeds;

    public FeedFetcher (StopBoardConfig.Feeds feeds) {
        this.feeds = feeds;
    }

    public List<String> listCities () {
        return ImmutableList.copyOf(feeds.cities.keySet());
    }

    /**
     * @return the path a city's archive is stored at, whether or not it has been downloaded.
     */
    public File archiveFor (String city) {
        Util.ensureValidCityId(city);
        return new File(feeds.directory, city + ".zip");
    }

    /**
     * Expand a city argument into the list of cities it stands for.
     * @param cityOrAll a configured city id, or null or {@value #ALL_CITIES} for every city
     * @throws UnknownCityException if the city is not configured
     */
    public List<String> resolveCities (String cityOrAll) throws UnknownCityException {
        if (cityOrAll == null || ALL_CITIES.equals(cityOrAll)) return listCities();
        if (!feeds.cities.containsKey(cityOrAll)) throw new UnknownCityException(cityOrAll, feeds.cities.keySet());
        return ImmutableList.of(cityOrAll);
    }

    /**
     * Download the archives for one city or all cities.
     *
     * @return one result per city, in configuration order
     * @throws UnknownCityException before any download if a specific city is not configured
     */
    public Map<String, FetchResult> download (String cityOrAll) throws UnknownCityException {
        List<String> cities = resolveCities(cityOrAll);
        Map<String, FetchResult> results = new LinkedHashMap<>();
        if (cities.isEmpty()) return results;
        int poolSize = Math.max(1, Math.min(feeds.maxConcurrentDownloads, cities.size()));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<FetchResult>> futures = new ArrayList<>();
            for (String city : cities) {
                String url = feeds.cities.get(city);
                futures.add(executor.submit(() -> downloadCity(city, url)));
            }
            for (int i = 0; i < cities.size(); i++) {
                String city = cities.get(i);
                try {
                    results.put(city, futures.get(i).get());
                } catch (ExecutionException e) {
                    LOG.error("Download task for {} failed", city, e.getCause());
                    results.put(city, FetchResult.failure(city, String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.put(city, FetchResult.failure(city, "Interrupted"));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        long succeeded = results.values().stream().filter(r -> r.success).count();
        LOG.info("Downloaded {} of {} feeds", succeeded, results.size());
        return results;
    }

    /**
     * Make a single attempt at downloading one archive. Every failure is converted into a failed result.
     */
    FetchResult downloadCity (String city, String url) {
        File target = archiveFor(city);
        File tempFile = null;
        HttpURLConnection conn = null;
        int timeoutMillis = (int) TimeUnit.SECONDS.toMillis(feeds.downloadTimeoutSeconds);
        try {
            LOG.info("Downloading feed for {} from {}", city, url);
            File directory = target.getAbsoluteFile().getParentFile();
            FileUtils.forceMkdir(directory);
            conn = (HttpURLConnection) new URL(url).openConnection();
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            conn.setInstanceFollowRedirects(true);
            conn.setRequestProperty("Accept", "*/*");
            // Set user agent request header in order to avoid 403 Forbidden response from some servers.
            conn.setRequestProperty("User-Agent", feeds.userAgent);
            int responseCode = conn.getResponseCode();
            if (responseCode < 200 || responseCode >= 300) {
                String message = String.format("HTTP %d", responseCode);
                LOG.error("Failed to download {}: {}", city, message);
                return FetchResult.failure(city, message);
            }
            tempFile = File.createTempFile("download-" + city, ".zip.part", directory);
            try (InputStream inputStream = conn.getInputStream()) {
                FileUtils.copyInputStreamToFile(inputStream, tempFile);
            }
            Files.move(tempFile.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            long size = target.length();
            LOG.info("Downloaded {}: {} bytes", city, human(size));
            return FetchResult.success(city, target.getPath(), size);
        } catch (SocketTimeoutException e) {
            LOG.error("Timed out downloading {} after {} s", city, feeds.downloadTimeoutSeconds);
            return FetchResult.failure(city, "Timed out: " + e.getMessage());
        } catch (IOException | RuntimeException e) {
            LOG.error("Error downloading {}: {}", city, e.toString());
            return FetchResult.failure(city, e.toString());
        } finally {
            if (tempFile != null && tempFile.exists()) FileUtils.deleteQuietly(tempFile);
            if (conn != null) conn.disconnect();
        }
    }

}
