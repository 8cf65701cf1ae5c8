/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request to fire one trigger of an event immediately.
 *
 * @param which
 *            1-based trigger number; missing or non-positive values select the first trigger
 */
@Schema(
        description = "Manual trigger request")
public record ManualTriggerRequestType(@Schema(
        description = "1-based trigger number",
        example = "1",
        defaultValue = "1") Integer which) {

    /**
     * Returns the zero-based trigger index this request selects.
     */
    public int index() {
        return which == null || which < 1 ? 0 : which - 1;
    }
}
