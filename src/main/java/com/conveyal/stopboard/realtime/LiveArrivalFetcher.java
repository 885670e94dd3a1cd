package com.conveyal.stopboard.realtime;

import com.conveyal.stopboard.StopBoardConfig;
import com.conveyal.stopboard.model.LiveArrival;
import com.conveyal.stopboard.util.GtfsTime;
import com.google.common.collect.ImmutableList;
import com.google.common.net.UrlEscapers;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fetches live arrival predictions for a stop from the operator's website.
 *
 * Live data is best effort. A single request is made with the configured timeout, and any failure (timeout, HTTP
 * error status, unreadable page) is logged and yields an empty list. Instances hold no mutable state and may be used
 * from several threads at once.
 */
public class LiveArrivalFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(LiveArrivalFetcher.class);

    private final StopBoardConfig.Live live;
    private final Clock clock;

    public LiveArrivalFetcher (StopBoardConfig.Live live, Clock clock) {
        this.live = live;
        this.clock = clock;
    }

    String urlFor (String stopId) {
        String base = live.baseUrl.endsWith("/") ? live.baseUrl : live.baseUrl + "/";
        return base + UrlEscapers.urlPathSegmentEscaper().escape(stopId);
    }

    public List<LiveArrival> fetch (String stopId) {
        String url = urlFor(stopId);
        try {
            Connection.Response response = Jsoup.connect(url)
                .timeout((int) TimeUnit.SECONDS.toMillis(live.timeoutSeconds))
                .ignoreHttpErrors(true)
                .execute();
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOG.debug("Live arrivals page returned status {} for stop {}", response.statusCode(), stopId);
                return ImmutableList.of();
            }
            List<LiveArrival> arrivals = ArrivalPageParser.parse(response.parse(), GtfsTime.now(clock));
            LOG.debug("Found {} live arrivals for stop {}", arrivals.size(), stopId);
            return arrivals;
        } catch (SocketTimeoutException e) {
            LOG.warn("Timeout fetching arrivals for stop {}", stopId);
        } catch (IOException | RuntimeException e) {
            LOG.error("Error fetching arrivals for stop {}: {}", stopId, e.toString());
        }
        return ImmutableList.of();
    }

}
