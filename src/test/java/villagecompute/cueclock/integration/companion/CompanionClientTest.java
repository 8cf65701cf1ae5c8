/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration.companion;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import villagecompute.cueclock.config.RuntimeConfig;
import villagecompute.cueclock.testing.WireMockTestBase;

/**
 * Tests for {@link CompanionClient} against a stubbed Companion HTTP API.
 */
class CompanionClientTest extends WireMockTestBase {

    private CompanionClient client() {
        return new CompanionClient(baseUrl() + "/", Duration.ofSeconds(2));
    }

    @Test
    void testAttempt_postsToApiRoute() {
        stubFor(post(urlEqualTo("/api/location/1/0/1/press")).willReturn(aResponse().withStatus(200)));
        CompanionClient client = client();

        assertTrue(client.attempt("/location/1/0/1/press"));

        verify(1, postRequestedFor(urlEqualTo("/api/location/1/0/1/press")));
        assertTrue(client.isConnected());
    }

    @Test
    void testAttempt_errorStatusIsFailure() {
        stubFor(post(urlEqualTo("/api/location/1/0/1/press")).willReturn(aResponse().withStatus(500)));
        CompanionClient client = client();

        assertFalse(client.attempt("location/1/0/1/press"));
        assertFalse(client.isConnected());
    }

    @Test
    void testAttempt_slowServiceTimesOut() {
        stubFor(post(urlEqualTo("/api/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(3000)));
        CompanionClient client = new CompanionClient(baseUrl(), Duration.ofSeconds(1));

        assertFalse(client.attempt("slow"));
    }

    @Test
    void testCheckConnection_reachable() {
        stubFor(get(urlEqualTo("/")).willReturn(aResponse().withStatus(200)));
        CompanionClient client = client();

        assertFalse(client.isConnected());
        assertTrue(client.checkConnection());
        assertTrue(client.isConnected());
    }

    @Test
    void testCheckConnection_unreachable() {
        CompanionClient client = new CompanionClient("http://127.0.0.1:1", Duration.ofSeconds(1));

        assertFalse(client.checkConnection());
        assertFalse(client.attempt("location/1/0/1/press"));
    }

    @Test
    void testFromConfig_usesConfiguredAddress() {
        RuntimeConfig config = new RuntimeConfig(null, null, "10.0.0.9", 8123, Duration.ofSeconds(3), false);

        CompanionClient client = CompanionClient.fromConfig(config);

        assertEquals("http://10.0.0.9:8123", client.getBaseUrl());
        assertEquals("http://10.0.0.9:8123/api/a/b", client.buildApiUrl("//a/b"));
    }
}
