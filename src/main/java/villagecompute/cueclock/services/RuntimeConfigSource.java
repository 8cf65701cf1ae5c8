/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import villagecompute.cueclock.config.RuntimeConfig;

/**
 * Live-editable runtime configuration.
 */
public interface RuntimeConfigSource {

    /**
     * Returns the last successfully read snapshot.
     */
    RuntimeConfig current();

    /**
     * Re-reads the configuration when its modification timestamp moved.
     *
     * <p>
     * A store that cannot be read or parsed counts as "no change": the previous snapshot stays in force.
     *
     * @return {@code true} when a snapshot with different values was adopted
     */
    boolean refresh();
}
