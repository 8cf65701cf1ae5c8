/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;

import villagecompute.cueclock.exceptions.ActionRejectedException;

/**
 * Confines internal-call actions to routes of this process's own API.
 *
 * <p>
 * A path is accepted only when, once normalized, it names a route beneath the fixed prefix (default {@code /api/}).
 * Absolute URLs, scheme-relative or backslash paths, anything carrying a scheme or host, encoded separators and {@code ..}
 * segments are rejected. {@code ping}, {@code /ping}, {@code api/ping} and {@code /api/ping} all
 * canonicalize to {@code /api/ping}. A query string is kept as-is.
 */
public final class LocalPathPolicy {

    public static final String DEFAULT_PREFIX = "/api/";

    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private final String prefix;
    private final String prefixSegment;

    public LocalPathPolicy(String prefix) {
        String segment = prefix == null ? "" : prefix.trim();
        while (segment.startsWith("/")) {
            segment = segment.substring(1);
        }
        while (segment.endsWith("/")) {
            segment = segment.substring(0, segment.length() - 1);
        }
        this.prefixSegment = segment;
        this.prefix = segment.isEmpty() ? "/" : "/" + segment + "/";
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Returns the upper-case method when it is one the local API accepts.
     *
     * @throws ActionRejectedException
     *             for any other method
     */
    public String checkMethod(String method) {
        String normalized = method == null ? "" : method.trim().toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(normalized)) {
            throw new ActionRejectedException("HTTP method '" + method + "' is not allowed for internal calls");
        }
        return normalized;
    }

    /**
     * Returns the canonical local form of {@code rawPath}.
     *
     * @throws ActionRejectedException
     *             if the path is not a route beneath the prefix
     */
    public String canonicalize(String rawPath) {
        String raw = rawPath == null ? "" : rawPath.trim();
        if (raw.isEmpty()) {
            throw new ActionRejectedException("Internal call has no path");
        }
        if (raw.contains("://") || raw.startsWith("//") || raw.contains("\\")) {
            throw new ActionRejectedException("Internal call path must be local, got '" + raw + "'");
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.contains("%2e") || lower.contains("%2f") || lower.contains("%5c")) {
            throw new ActionRejectedException("Internal call path contains encoded separators: '" + raw + "'");
        }

        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw new ActionRejectedException("Internal call path is not a valid URI path: '" + raw + "'");
        }
        if (uri.getScheme() != null || uri.getRawAuthority() != null) {
            throw new ActionRejectedException("Internal call path must not name a scheme or host: '" + raw + "'");
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String query = uri.getRawQuery();

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new ActionRejectedException("Internal call path must not climb directories: '" + raw + "'");
            }
            segments.addLast(segment);
        }
        if (!prefixSegment.isEmpty() && prefixSegment.equals(segments.peekFirst())) {
            segments.removeFirst();
        }
        if (segments.isEmpty()) {
            throw new ActionRejectedException("Internal call path names no route: '" + raw + "'");
        }

        String canonical = prefix + String.join("/", segments);
        return query == null ? canonical : canonical + "?" + query;
    }
}
