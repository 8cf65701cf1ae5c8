/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.integration;

/**
 * External service that executes button presses (Bitfocus Companion).
 */
public interface ButtonPressSink {

    /**
     * Presses the button addressed by {@code url}.
     *
     * @param url
     *            button route relative to the service's API root, e.g. {@code location/1/0/1/press}
     * @return {@code true} when the service acknowledged the press
     */
    boolean attempt(String url);

    /**
     * Returns the outcome of the most recent probe or press without touching the network.
     */
    boolean isConnected();

    /**
     * Actively probes the service and updates {@link #isConnected()}.
     */
    boolean checkConnection();
}
