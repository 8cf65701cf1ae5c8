/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One queued trigger job.
 *
 * @param due
 *            local due time, second resolution
 * @param secondsUntil
 *            seconds from now until the job is due
 * @param eventId
 *            event the trigger belongs to
 * @param event
 *            event name
 * @param triggerIndex
 *            1-based trigger number within the event, usable with the manual trigger endpoint
 * @param offsetMinutes
 *            signed offset relative to the occurrence
 * @param sink
 *            sink the action targets
 * @param action
 *            short action description
 */
@Schema(
        description = "Queued trigger job")
public record UpcomingTriggerType(@Schema(
        description = "Local due time",
        example = "2025-01-05T10:25:00",
        required = true) String due,

        @Schema(
                description = "Seconds until the job is due",
                example = "42",
                required = true) @JsonProperty("seconds_until") long secondsUntil,

        @Schema(
                description = "Event identifier",
                example = "1",
                required = true) @JsonProperty("event_id") long eventId,

        @Schema(
                description = "Event name",
                example = "Sunday service") String event,

        @Schema(
                description = "1-based trigger number within the event",
                example = "1",
                required = true) @JsonProperty("trigger_index") int triggerIndex,

        @Schema(
                description = "Signed offset in minutes relative to the occurrence",
                example = "-5",
                required = true) @JsonProperty("offset_min") int offsetMinutes,

        @Schema(
                description = "Action sink",
                example = "COMPANION") String sink,

        @Schema(
                description = "Action description",
                example = "press 'location/1/0/1/press'") String action) {
}
