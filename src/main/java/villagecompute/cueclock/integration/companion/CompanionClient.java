/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration.companion;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.jboss.logging.Logger;

import villagecompute.cueclock.config.RuntimeConfig;
import villagecompute.cueclock.integration.ButtonPressSink;

/**
 * HTTP client for the Bitfocus Companion button-press service.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Press: {@code POST {base}/api/{url}}, any 2xx counts as success</li>
 * <li>Probe: {@code GET {base}/}, any status below 400 counts as reachable</li>
 * <li>No authentication</li>
 * </ul>
 *
 * <p>
 * Failures never throw: network errors and timeouts are reported as {@code false} and logged at DEBUG. The caller
 * decides whether a failure is worth a louder log line.
 *
 * <p>
 * Built from a {@link RuntimeConfig} snapshot. A configuration reload produces a new client rather than mutating this
 * one.
 */
public class CompanionClient implements ButtonPressSink {

    private static final Logger LOG = Logger.getLogger(CompanionClient.class);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    private volatile boolean connected;

    public CompanionClient(String baseUrl, Duration timeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * Creates a client for the Companion address in {@code config}.
     */
    public static CompanionClient fromConfig(RuntimeConfig config) {
        return new CompanionClient(config.companionBaseUrl(), config.companionTimeout());
    }

    @Override
    public boolean attempt(String url) {
        String fullUrl = buildApiUrl(url);
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(fullUrl)).timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.noBody()).build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            boolean ok = response.statusCode() >= 200 && response.statusCode() < 300;
            LOG.debugf("Companion POST %s returned %d", fullUrl, response.statusCode());
            connected = ok;
            return ok;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connected = false;
            return false;
        } catch (Exception e) {
            LOG.debugf("Companion POST %s failed: %s", fullUrl, e.toString());
            connected = false;
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean checkConnection() {
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/")).timeout(timeout).GET()
                    .build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            connected = response.statusCode() < 400;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connected = false;
        } catch (Exception e) {
            LOG.debugf("Companion probe of %s failed: %s", baseUrl, e.toString());
            connected = false;
        }
        return connected;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Always prefixes {@code /api/} to the button route, dropping leading slashes.
     */
    String buildApiUrl(String url) {
        String route = url == null ? "" : url.trim();
        while (route.startsWith("/")) {
            route = route.substring(1);
        }
        return baseUrl + "/api/" + route;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
