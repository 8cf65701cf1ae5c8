/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.rest;

import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.cueclock.api.types.SchedulerStatusType;
import villagecompute.cueclock.api.types.UpcomingTriggerType;
import villagecompute.cueclock.services.SchedulerService;

/**
 * REST endpoint for inspecting and nudging the trigger engine.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/scheduler/status} – engine state, queue depth, sink connectivity</li>
 * <li>{@code GET /api/scheduler/upcoming} – next queued jobs</li>
 * <li>{@code POST /api/scheduler/reload} – request a queue rebuild</li>
 * <li>{@code POST /api/scheduler/start} and {@code POST /api/scheduler/stop} – run or halt the engine threads</li>
 * </ul>
 */
@Path("/api/scheduler")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Scheduler",
        description = "Trigger engine inspection and control operations")
public class SchedulerResource {

    @Inject
    SchedulerService schedulerService;

    @GET
    @Path("/status")
    @Operation(
            summary = "Get engine status",
            description = "Dispatch loop state, pending job count, last reload time and sink connectivity")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Status returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SchedulerStatusType.class)))})
    public SchedulerStatusType status() {
        return schedulerService.status();
    }

    @GET
    @Path("/upcoming")
    @Operation(
            summary = "List upcoming triggers",
            description = "Next queued trigger jobs, earliest first")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Upcoming triggers returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = UpcomingTriggerType.class)))})
    public List<UpcomingTriggerType> upcoming(@Parameter(
            description = "Maximum number of jobs (1-100)") @QueryParam("limit") @DefaultValue("3") int limit) {
        return schedulerService.upcoming(limit);
    }

    @POST
    @Path("/reload")
    @Operation(
            summary = "Request reload",
            description = "Ask the dispatch loop to rebuild its queue from the event store")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Reload requested",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON))})
    public Response reload() {
        schedulerService.requestReload();
        return Response.accepted(Map.of("reload_requested", true, "running", schedulerService.isRunning())).build();
    }

    @POST
    @Path("/start")
    @Operation(
            summary = "Start engine",
            description = "Start the dispatch loop and reload watcher; a stopped engine starts over with a full reload")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Engine running",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SchedulerStatusType.class)))})
    public SchedulerStatusType start() {
        schedulerService.start();
        return schedulerService.status();
    }

    @POST
    @Path("/stop")
    @Operation(
            summary = "Stop engine",
            description = "Stop the dispatch loop and reload watcher; queued jobs are discarded")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Engine stopped",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = SchedulerStatusType.class)))})
    public SchedulerStatusType stop() {
        schedulerService.stop();
        return schedulerService.status();
    }
}
