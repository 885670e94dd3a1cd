package com.conveyal.stopboard.realtime;

import com.conveyal.stopboard.StopBoardConfig;
import com.conveyal.stopboard.TestUtils;
import com.conveyal.stopboard.model.LiveArrival;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

public class LiveArrivalFetcherTest {

    /** 10:00 in Cyprus. */
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    private static WireMockServer wireMockServer;
    private LiveArrivalFetcher fetcher;

    @BeforeAll
    public static void setUpServer() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
    }

    @AfterAll
    public static void tearDownServer() {
        wireMockServer.stop();
    }

    @BeforeEach
    public void setUp() {
        wireMockServer.resetAll();
        StopBoardConfig.Live live = new StopBoardConfig.Live();
        live.baseUrl = wireMockServer.baseUrl() + "/routes/stop";
        live.timeoutSeconds = 1;
        fetcher = new LiveArrivalFetcher(live, CLOCK);
    }

    @Test
    public void canFetchArrivals() throws IOException {
        wireMockServer.stubFor(get(urlPathEqualTo("/routes/stop/1002")).willReturn(aResponse()
            .withStatus(200)
            .withHeader("Content-Type", "text/html; charset=utf-8")
            .withBody(TestUtils.readResource("live-pages/stop-1002.html"))));
        List<LiveArrival> arrivals = fetcher.fetch("1002");
        assertThat(arrivals, hasSize(3));
        assertThat(arrivals.get(0).route_short_name, equalTo("30"));
        assertThat(arrivals.get(0).arrival_time, equalTo("10:05:00"));
        assertThat(arrivals.get(1).time_left, equalTo(30));
    }

    @Test
    public void errorStatusYieldsNoArrivals() {
        wireMockServer.stubFor(get(urlPathEqualTo("/routes/stop/1002")).willReturn(aResponse().withStatus(404)));
        assertThat(fetcher.fetch("1002"), empty());
    }

    @Test
    public void timeoutYieldsNoArrivals() throws IOException {
        wireMockServer.stubFor(get(urlPathEqualTo("/routes/stop/1002")).willReturn(aResponse()
            .withStatus(200)
            .withFixedDelay(3000)
            .withBody(TestUtils.readResource("live-pages/stop-1002.html"))));
        assertThat(fetcher.fetch("1002"), empty());
    }

    @Test
    public void unreachableHostYieldsNoArrivals() {
        StopBoardConfig.Live live = new StopBoardConfig.Live();
        live.baseUrl = "http://localhost:1/routes/stop";
        live.timeoutSeconds = 1;
        assertThat(new LiveArrivalFetcher(live, CLOCK).fetch("1002"), empty());
    }

    @Test
    public void stopIdIsEscapedInUrl() {
        StopBoardConfig.Live live = new StopBoardConfig.Live();
        live.baseUrl = "https://example.com/routes/stop/";
        LiveArrivalFetcher escaping = new LiveArrivalFetcher(live, CLOCK);
        assertThat(escaping.urlFor("10 02/a"), equalTo("https://example.com/routes/stop/10%2002%2Fa"));
        assertThat(escaping.urlFor("1002"), equalTo("https://example.com/routes/stop/1002"));
    }

}
