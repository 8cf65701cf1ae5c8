/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration;

import java.time.Duration;

/**
 * Executes calls against this process's own local API.
 *
 * <p>
 * {@code localPath} must already be canonicalized beneath the local API prefix; implementations only send it.
 */
public interface InternalCallSink {

    /**
     * Sends {@code method} to {@code localPath}.
     *
     * @param method
     *            upper-case HTTP method
     * @param localPath
     *            canonical path starting with the local API prefix, query string allowed
     * @param body
     *            optional JSON body, {@code null} or blank for none
     * @param timeout
     *            bound on the whole request
     * @return {@code true} for a 2xx response
     */
    boolean attempt(String method, String localPath, String body, Duration timeout);
}
