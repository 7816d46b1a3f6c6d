package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.config.DiscoveryConfig;
import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.http.PoliteHttpClient;
import com.delta.creatorscout.discovery.model.CandidateCreator;
import com.delta.creatorscout.discovery.model.DiscoveryJob;
import com.delta.creatorscout.discovery.model.FailureKind;
import com.delta.creatorscout.discovery.model.Platform;
import com.delta.creatorscout.discovery.model.SearchPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TikTokKeywordSearchClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private DiscoveryProperties properties;
    private ObjectMapper objectMapper;
    private TikTokKeywordSearchClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        properties = new DiscoveryProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getProvider().setBaseUrl(server.url("/").toString());
        properties.getProvider().setApiKey("test-key");

        executor = Executors.newFixedThreadPool(2);
        objectMapper = new DiscoveryConfig().objectMapper();
        client = new TikTokKeywordSearchClient(properties, new PoliteHttpClient(properties, executor), objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void parsesVideoAuthorsAndAdvancesOffset() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(DiscoveryJobFixtures.fixture("tiktok-keyword-page.json")));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness", "yoga"));

        SearchPage page = client.fetchPage(job, null);

        assertThat(page.candidates()).extracting(CandidateCreator::platformUserId).containsExactly("6801", "6802");
        CandidateCreator ana = page.candidates().get(0);
        assertThat(ana.handle()).isEqualTo("fitwithana");
        assertThat(ana.followerCount()).isEqualTo(15_300);
        assertThat(ana.likes()).isEqualTo(1_200);
        assertThat(ana.source().caption()).isEqualTo("Leg day & protein");
        assertThat(ana.source().hashtags()).containsExactly("fitness");
        assertThat(page.candidates().get(1).verified()).isTrue();
        assertThat(page.candidates().get(1).likes()).isEqualTo(1_200);

        assertThat(page.hasMore()).isTrue();
        SearchCursor next = SearchCursor.decode(objectMapper, page.nextCursor());
        assertThat(next.keywordIndex()).isZero();
        assertThat(next.offset()).isEqualTo(20);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/tiktok/search/keyword?query=fitness&cursor=0&region=US");
        assertThat(request.getHeader("x-api-key")).isEqualTo("test-key");
    }

    @Test
    void exhaustedKeywordMovesToTheNextOne() {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"success\":true,\"has_more\":false,\"search_item_list\":[]}"));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness", "yoga"));

        SearchPage page = client.fetchPage(job, null);

        assertThat(page.candidates()).isEmpty();
        assertThat(page.hasMore()).isTrue();
        assertThat(SearchCursor.decode(objectMapper, page.nextCursor()).keywordIndex()).isEqualTo(1);
    }

    @Test
    void lastKeywordEndsTheSearch() {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"success\":true,\"has_more\":false,\"search_item_list\":[]}"));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness"));

        SearchPage page = client.fetchPage(job, null);

        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void malformedPageCanBeSkippedToTheNextKeyword() {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"success\":true,\"search_item_list\":\"unavailable\"}"));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness", "yoga"));

        assertThatThrownBy(() -> client.fetchPage(job, null))
            .isInstanceOfSatisfying(PlatformFetchException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FailureKind.MALFORMED_RESPONSE);
                assertThat(e.isCursorIndependent()).isTrue();
                assertThat(SearchCursor.decode(objectMapper, e.getNextCursor()).keywordIndex()).isEqualTo(1);
            });
    }

    @Test
    void rateLimitIsClassified() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "1"));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness"));

        assertThatThrownBy(() -> client.fetchPage(job, null))
            .isInstanceOfSatisfying(PlatformFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.RATE_LIMITED));
    }

    @Test
    void serverErrorIsReportedAfterOneRequest() {
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200)
            .setBody("{\"success\":true,\"has_more\":false,\"search_item_list\":[]}"));
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness"));

        assertThatThrownBy(() -> client.fetchPage(job, null))
            .isInstanceOfSatisfying(PlatformFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.UPSTREAM_SERVER_ERROR));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void missingApiKeyIsFatalWithoutRequest() {
        properties.getProvider().setApiKey(" ");
        DiscoveryJob job = DiscoveryJobFixtures.keywordJob(Platform.TIKTOK, List.of("fitness"));

        assertThatThrownBy(() -> client.fetchPage(job, null))
            .isInstanceOfSatisfying(PlatformFetchException.class,
                e -> assertThat(e.getKind()).isEqualTo(FailureKind.FATAL));
        assertThat(server.getRequestCount()).isZero();
    }
}
