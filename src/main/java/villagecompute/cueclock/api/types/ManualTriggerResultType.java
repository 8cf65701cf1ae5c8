/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of a manual trigger.
 *
 * @param ok
 *            whether the sink reported success
 * @param eventId
 *            event the trigger belongs to
 * @param which
 *            1-based trigger number that was fired
 * @param action
 *            short action description
 */
@Schema(
        description = "Manual trigger outcome")
public record ManualTriggerResultType(@Schema(
        description = "Whether the sink reported success",
        required = true) boolean ok,

        @Schema(
                description = "Event identifier",
                example = "1",
                required = true) @JsonProperty("event_id") long eventId,

        @Schema(
                description = "1-based trigger number",
                example = "1",
                required = true) int which,

        @Schema(
                description = "Action description",
                example = "POST /api/scheduler/reload") String action) {
}
