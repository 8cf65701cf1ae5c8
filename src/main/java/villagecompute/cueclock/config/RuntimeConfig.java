/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.config;

import java.time.Duration;

/**
 * Immutable snapshot of the live-editable runtime configuration ({@code config.json}).
 *
 * <p>
 * Values are clamped on construction so a bad edit cannot stall the loop or hang a dispatch:
 * <ul>
 * <li>{@code poll_interval}: 1-60 seconds, default 1</li>
 * <li>{@code internal_api_timeout_seconds}: 1-120 seconds, default 10 (legacy device chains can be slow)</li>
 * <li>{@code companion_timeout_seconds}: 1-30 seconds, default 2</li>
 * </ul>
 *
 * @param pollInterval
 *            how often the reload watcher probes the stores
 * @param internalCallTimeout
 *            bound on each internal API call
 * @param companionHost
 *            Companion host name or address
 * @param companionPort
 *            Companion HTTP port
 * @param companionTimeout
 *            bound on each Companion request
 * @param debug
 *            enables next-trigger countdown announcements
 */
public record RuntimeConfig(Duration pollInterval, Duration internalCallTimeout, String companionHost,
        int companionPort, Duration companionTimeout, boolean debug) {

    public static final long DEFAULT_POLL_INTERVAL_SECONDS = 1;
    public static final long DEFAULT_INTERNAL_CALL_TIMEOUT_SECONDS = 10;
    public static final long DEFAULT_COMPANION_TIMEOUT_SECONDS = 2;
    public static final String DEFAULT_COMPANION_HOST = "127.0.0.1";
    public static final int DEFAULT_COMPANION_PORT = 8888;

    public RuntimeConfig {
        pollInterval = clamp(pollInterval, DEFAULT_POLL_INTERVAL_SECONDS, 1, 60);
        internalCallTimeout = clamp(internalCallTimeout, DEFAULT_INTERNAL_CALL_TIMEOUT_SECONDS, 1, 120);
        companionTimeout = clamp(companionTimeout, DEFAULT_COMPANION_TIMEOUT_SECONDS, 1, 30);
        companionHost = companionHost == null || companionHost.isBlank() ? DEFAULT_COMPANION_HOST
                : companionHost.trim();
        if (companionPort <= 0 || companionPort > 65535) {
            companionPort = DEFAULT_COMPANION_PORT;
        }
    }

    /**
     * Returns the configuration used when {@code config.json} is missing.
     */
    public static RuntimeConfig defaults() {
        return new RuntimeConfig(null, null, null, DEFAULT_COMPANION_PORT, null, false);
    }

    /**
     * Returns the Companion base URL, e.g. {@code http://127.0.0.1:8888}.
     */
    public String companionBaseUrl() {
        return "http://" + companionHost + ":" + companionPort;
    }

    private static Duration clamp(Duration value, long defaultSeconds, long minSeconds, long maxSeconds) {
        if (value == null) {
            return Duration.ofSeconds(defaultSeconds);
        }
        long seconds = Math.max(minSeconds, Math.min(maxSeconds, value.getSeconds()));
        return Duration.ofSeconds(seconds);
    }
}
