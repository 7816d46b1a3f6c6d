package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryConfig;
import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchPage;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class InstagramSimilarSearchClientTest {
    private static final String PROFILE = """
        {
          "data": {
            "user": {
              "username": "natgeo",
              "edge_related_profiles": {
                "edges": [
                  { "node": { "id": "101", "username": "natgeotravel", "full_name": "NatGeo Travel", "is_verified": true } },
                  { "node": { "id": "102", "username": "NatGeo", "full_name": "Duplicate of seed" } },
                  { "node": { "id": "103", "username": "oceanlens", "is_private": true } }
                ]
              }
            }
          }
        }
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private InstagramSimilarSearchClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setRequestMaxRetries(0);
        properties.getProvider().setBaseUrl(server.url("/").toString());
        properties.getProvider().setApiKey("test-key");
        executor = Executors.newFixedThreadPool(2);
        client = new InstagramSimilarSearchClient(
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
    void relatedProfilesOfSeedAreOneFinalPage() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PROFILE));
        DiscoveryJob job = DiscoveryJobFixtures.similarJob(Platform.INSTAGRAM, "@natgeo");

        SearchPage page = client.fetchPage(job, null);

        assertThat(page.candidates()).extracting(CandidateCreator::handle).containsExactly("natgeotravel", "oceanlens");
        assertThat(page.candidates().get(0).verified()).isTrue();
        assertThat(page.candidates().get(1).privateAccount()).isTrue();
        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/instagram/profile?handle=natgeo");
    }

    @Test
    void resumedCursorIsAlreadyExhausted() {
        DiscoveryJob job = DiscoveryJobFixtures.similarJob(Platform.INSTAGRAM, "natgeo");

        SearchPage page = client.fetchPage(job, "{\"keywordIndex\":1,\"offset\":0}");

        assertThat(page.candidates()).isEmpty();
        assertThat(page.hasMore()).isFalse();
        assertThat(server.getRequestCount()).isZero();
    }
}
