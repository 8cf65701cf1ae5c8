/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration.localapi;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.any;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.patchRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import villagecompute.cueclock.testing.WireMockTestBase;

/**
 * Tests for {@link LocalApiClient} against a stubbed local API.
 */
class LocalApiClientTest extends WireMockTestBase {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Test
    void testAttempt_getWithoutBody() {
        stubFor(any(urlEqualTo("/api/health")).willReturn(aResponse().withStatus(200)));

        assertTrue(new LocalApiClient(baseUrl()).attempt("GET", "/api/health", null, TIMEOUT));

        verify(1, getRequestedFor(urlEqualTo("/api/health")));
    }

    @Test
    void testAttempt_jsonBodyIsSent() {
        stubFor(any(urlEqualTo("/api/lights?zone=1")).willReturn(aResponse().withStatus(204)));

        assertTrue(new LocalApiClient(baseUrl() + "/").attempt("PATCH", "/api/lights?zone=1", "{\"on\": true}",
                TIMEOUT));

        verify(1, patchRequestedFor(urlEqualTo("/api/lights?zone=1"))
                .withHeader("Content-Type", equalTo("application/json")).withRequestBody(equalToJson("{\"on\":true}")));
    }

    @Test
    void testAttempt_non2xxIsFailure() {
        stubFor(any(urlEqualTo("/api/missing")).willReturn(aResponse().withStatus(404)));

        assertFalse(new LocalApiClient(baseUrl()).attempt("POST", "/api/missing", null, TIMEOUT));
    }

    @Test
    void testAttempt_timeoutIsFailure() {
        stubFor(any(urlEqualTo("/api/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

        assertFalse(new LocalApiClient(baseUrl()).attempt("POST", "/api/slow", null, Duration.ofSeconds(1)));
    }

    @Test
    void testAttempt_unreachableIsFailure() {
        assertFalse(new LocalApiClient("http://127.0.0.1:1").attempt("GET", "/api/health", null, TIMEOUT));
    }

    @Test
    void testOriginTrailingSlashIsStripped() {
        assertEquals("http://127.0.0.1:8080", new LocalApiClient("http://127.0.0.1:8080/").getOrigin());
    }
}
