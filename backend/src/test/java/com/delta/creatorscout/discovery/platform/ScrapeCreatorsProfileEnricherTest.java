package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryConfig;
import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.ProfileEnrichment;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeCreatorsProfileEnricherTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private MockWebServer server;
    private ExecutorService executor;
    private ScrapeCreatorsProfileEnricher enricher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setRequestMaxRetries(0);
        properties.getProvider().setBaseUrl(server.url("/").toString());
        properties.getProvider().setApiKey("test-key");
        executor = Executors.newFixedThreadPool(2);
        enricher = new ScrapeCreatorsProfileEnricher(
            properties,
            new PoliteHttpClient(properties, executor),
            new DiscoveryConfig().objectMapper()
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void tiktokProfileSuppliesBioFollowersAndBusinessFlag() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {"user":{"signature":"Coach | ana@fit.example","commerceUserInfo":{"commerceUser":true}},
             "stats":{"followerCount":20100}}
            """));

        ProfileEnrichment enrichment = enricher.enrich(Platform.TIKTOK, creator("6801", "@fitwithana"), TIMEOUT);

        assertThat(enrichment.biography()).isEqualTo("Coach | ana@fit.example");
        assertThat(enrichment.followerCount()).isEqualTo(20_100L);
        assertThat(enrichment.businessAccount()).isTrue();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/tiktok/profile?handle=fitwithana&region=US");
    }

    @Test
    void youtubeEmailIsAppendedToDescription() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {"description":"Coffee every day","email":"bob@brews.example","subscriberCountText":"1.2M subscribers"}
            """));

        ProfileEnrichment enrichment = enricher.enrich(Platform.YOUTUBE, creator("UC1", null), TIMEOUT);

        assertThat(enrichment.biography()).isEqualTo("Coffee every day\nbob@brews.example");
        assertThat(enrichment.followerCount()).isEqualTo(1_200_000L);
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/youtube/channel?channelId=UC1");
    }

    @Test
    void missingFollowerCountLeavesSearchValue() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"biography\":\"Plant based\"}"));

        ProfileEnrichment enrichment = enricher.enrich(Platform.INSTAGRAM, creator("77", "plantbased.pat"), TIMEOUT);

        assertThat(enrichment.followerCount()).isNull();
        assertThat(enrichment.businessAccount()).isFalse();
    }

    @Test
    void failuresAreReportedAsEnrichmentFailures() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> enricher.enrich(Platform.INSTAGRAM, creator("77", "gone"), TIMEOUT))
            .isInstanceOfSatisfying(PlatformFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.ENRICHMENT_FAILURE));
        assertThatThrownBy(() -> enricher.enrich(Platform.TIKTOK, creator("6802", null), TIMEOUT))
            .isInstanceOfSatisfying(PlatformFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.ENRICHMENT_FAILURE));
    }

    private static CandidateCreator creator(String id, String handle) {
        return new CandidateCreator(id, handle, null, false, false, 900, null);
    }
}
