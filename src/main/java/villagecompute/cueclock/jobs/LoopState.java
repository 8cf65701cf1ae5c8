/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

/**
 * States of the {@link DispatchLoop}.
 */
public enum LoopState {

    /**
     * Rebuilding the queue from the latest event and configuration snapshot.
     */
    AWAITING_RELOAD,

    /**
     * Queue is empty; blocked until a reload signal or a short timeout.
     */
    IDLE,

    /**
     * Sleeping in bounded steps until the earliest job is due or a reload is signalled.
     */
    WAITING,

    /**
     * Draining every job whose due time has passed.
     */
    FIRING,

    /**
     * Loop has exited after a stop request.
     */
    STOPPED
}
