package com.delta.creatorscout.discovery;

import com.delta.creatorscout.config.DiscoveryProperties;
import com.delta.creatorscout.discovery.model.Platform;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscoveryPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("creator-scout/0.1"));
    }

    @Test
    void enrichmentBatchSizeStaysBetweenOneAndFive() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getEnrichment().setBatchSize(50);
        assertEquals(5, properties.getEnrichment().getBatchSize());
        properties.getEnrichment().setBatchSize(0);
        assertEquals(1, properties.getEnrichment().getBatchSize());
    }

    @Test
    void continuationDelaysNeverDropBelowMinimum() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getContinuation().setMinDelayMs(400);
        properties.getContinuation().setTiktokDelayMs(-5);
        assertEquals(400, properties.getContinuation().baseDelayMs(Platform.TIKTOK));
        assertEquals(2000, properties.getContinuation().baseDelayMs(Platform.INSTAGRAM));
    }

    @Test
    void providerBaseUrlDropsTrailingSlash() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getProvider().setBaseUrl("http://localhost:8089/ ");
        assertEquals("http://localhost:8089", properties.getProvider().getBaseUrl());
        properties.getProvider().setBaseUrl(null);
        assertEquals("https://api.scrapecreators.com", properties.getProvider().getBaseUrl());
    }

    @Test
    void apiCallCeilingIsNeverBelowDefault() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getJobs().setDefaultMaxApiCalls(80);
        properties.getJobs().setMaxApiCallsCeiling(10);
        assertEquals(80, properties.getJobs().getMaxApiCallsCeiling());
    }

    @Test
    void invocationBudgetAlwaysFitsOneEnrichmentBatch() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setRequestTimeoutSeconds(20);
        properties.getInvocation().setMaxDurationSeconds(5);
        properties.getEnrichment().setRequestTimeoutSeconds(10);
        properties.getEnrichment().setBatchSize(3);
        properties.getEnrichment().setInterRequestDelayMs(100);
        properties.getEnrichment().setInterBatchDelayMs(200);

        // 20s search + ceil(10s + 2 x 100ms + 200ms + 1s)
        assertEquals(32, properties.getInvocationBudgetSeconds());

        properties.getInvocation().setMaxDurationSeconds(120);
        assertEquals(120, properties.getInvocationBudgetSeconds());
    }
}
