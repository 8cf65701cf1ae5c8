/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Snapshot of the trigger engine's state.
 *
 * <p>
 * All JSON-marshalled types in this project use the Type suffix and record classes.
 *
 * @param running
 *            whether the dispatch loop thread is running
 * @param state
 *            current dispatch loop state
 * @param pendingJobs
 *            jobs waiting in the queue
 * @param eventsLoaded
 *            active events read at the last successful reload
 * @param lastReloadAt
 *            local time of the last successful reload, null before the first one
 * @param eventsFile
 *            path of the event store
 * @param sinks
 *            connectivity of each action sink
 */
@Schema(
        description = "Trigger engine status")
public record SchedulerStatusType(@Schema(
        description = "Whether the dispatch loop is running",
        required = true) boolean running,

        @Schema(
                description = "Dispatch loop state",
                example = "WAITING",
                required = true) String state,

        @Schema(
                description = "Jobs waiting in the queue",
                example = "4",
                required = true) @JsonProperty("pending_jobs") int pendingJobs,

        @Schema(
                description = "Active events read at the last successful reload",
                example = "2",
                required = true) @JsonProperty("events_loaded") int eventsLoaded,

        @Schema(
                description = "Local time of the last successful reload",
                example = "2025-01-05T10:15:00") @JsonProperty("last_reload_at") String lastReloadAt,

        @Schema(
                description = "Path of the event store",
                example = "events.json") @JsonProperty("events_file") String eventsFile,

        @Schema(
                description = "Connectivity of each action sink") List<SinkStatusType> sinks) {
}
