/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import villagecompute.cueclock.config.RuntimeConfig;

/**
 * Builds the dispatcher for a runtime configuration snapshot. Called by the dispatch loop at start and at every reload
 * that adopts a changed configuration.
 */
@FunctionalInterface
public interface ActionDispatcherFactory {

    ActionDispatcher create(RuntimeConfig config, ConnectivityTracker connectivity);
}
