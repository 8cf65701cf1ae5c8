/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

/**
 * External systems a dispatched trigger action can target.
 *
 * <p>
 * Each sink carries its own connectivity state so repeated failures against one sink do not produce repeated
 * transition log lines.
 */
public enum ActionSink {

    /**
     * Bitfocus Companion button-press service reached over HTTP.
     */
    COMPANION("button-press service"),

    /**
     * Routes of this process's own local API.
     */
    LOCAL_API("internal API");

    private final String description;

    ActionSink(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
