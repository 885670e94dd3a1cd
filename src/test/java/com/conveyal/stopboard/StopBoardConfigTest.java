package com.conveyal.stopboard;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

public class StopBoardConfigTest {

    @Test
    public void bundledConfigurationListsAllCities() throws IOException {
        StopBoardConfig config = StopBoardConfig.loadDefault();
        assertThat(config.feeds.cities.keySet(), contains(
            "limassol", "pafos", "famagusta", "intercity", "nicosia", "larnaca", "pame_express"
        ));
        assertThat(config.feeds.cities.get("limassol"), startsWith("https://motionbuscard.org.cy/"));
        assertThat(config.live.baseUrl, equalTo("https://motionbuscard.org.cy/routes/stop"));
        assertThat(config.importSettings.batchSize, equalTo(500));
    }

    @Test
    public void missingValuesKeepDefaults() throws IOException {
        String yaml = String.join("\n",
            "feeds:",
            "  directory: /tmp/feeds",
            "  cities:",
            "    larnaca: http://localhost/larnaca.zip",
            "unused: true",
            ""
        );
        StopBoardConfig config = StopBoardConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        assertThat(config.feeds.directory, equalTo("/tmp/feeds"));
        assertThat(config.feeds.cities.keySet(), contains("larnaca"));
        assertThat(config.feeds.downloadTimeoutSeconds, equalTo(60));
        assertThat(config.feeds.maxConcurrentDownloads, equalTo(4));
        assertThat(config.live.timeoutSeconds, equalTo(10));
        assertThat(config.database.url, equalTo("jdbc:postgresql://localhost/stopboard"));
        assertThat(config.importSettings.batchSize, equalTo(500));
    }

}
