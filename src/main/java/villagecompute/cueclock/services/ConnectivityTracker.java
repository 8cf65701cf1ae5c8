/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.util.EnumMap;
import java.util.Map;

import villagecompute.cueclock.data.models.ActionSink;

/**
 * Last known reachability of each action sink.
 *
 * <p>
 * Every sink starts as up, so the first failure reports {@link Transition#WENT_OFFLINE} exactly once and a sustained
 * outage reports nothing further until the sink recovers.
 */
public final class ConnectivityTracker {

    public enum Transition {
        NONE, WENT_OFFLINE, CAME_ONLINE
    }

    private final Map<ActionSink, Boolean> lastKnownUp = new EnumMap<>(ActionSink.class);

    /**
     * Records the outcome of one attempt and reports whether it flipped the sink's state.
     */
    public synchronized Transition record(ActionSink sink, boolean ok) {
        boolean wasUp = lastKnownUp.getOrDefault(sink, Boolean.TRUE);
        lastKnownUp.put(sink, ok);
        if (wasUp && !ok) {
            return Transition.WENT_OFFLINE;
        }
        if (!wasUp && ok) {
            return Transition.CAME_ONLINE;
        }
        return Transition.NONE;
    }

    public synchronized boolean isUp(ActionSink sink) {
        return lastKnownUp.getOrDefault(sink, Boolean.TRUE);
    }
}
