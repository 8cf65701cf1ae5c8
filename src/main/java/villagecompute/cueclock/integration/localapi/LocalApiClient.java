/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration.localapi;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.jboss.logging.Logger;

import villagecompute.cueclock.integration.InternalCallSink;

/**
 * HTTP client for calls back into this process's own REST API.
 *
 * <p>
 * The origin is fixed at construction (normally loopback plus the Quarkus HTTP port), so a caller can only choose the
 * path. Bodies are sent as {@code application/json}; a 2xx response counts as success.
 */
public class LocalApiClient implements InternalCallSink {

    private static final Logger LOG = Logger.getLogger(LocalApiClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final String origin;
    private final HttpClient httpClient;

    public LocalApiClient(String origin) {
        String trimmed = origin.trim();
        this.origin = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    }

    @Override
    public boolean attempt(String method, String localPath, String body, Duration timeout) {
        String url = origin + localPath;
        HttpRequest.BodyPublisher publisher = body == null || body.isBlank() ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout)
                    .method(method, publisher);
            if (body != null && !body.isBlank()) {
                builder.header("Content-Type", "application/json");
            }
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            LOG.debugf("Local API %s %s returned %d", method, localPath, response.statusCode());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.debugf("Local API %s %s failed: %s", method, localPath, e.toString());
            return false;
        }
    }

    public String getOrigin() {
        return origin;
    }
}
