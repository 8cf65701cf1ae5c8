/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import villagecompute.cueclock.services.SchedulerService;

/**
 * Liveness of the process and of the trigger engine.
 *
 * <p>
 * The process is UP whenever it answers. An engine that was started but whose dispatch thread died reports DEGRADED.
 */
@Path("/api/health")
@Tag(
        name = "Health",
        description = "Liveness check")
public class HealthResource {

    @Inject
    SchedulerService schedulerService;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Process liveness plus whether the dispatch thread is alive and what it is doing")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Process is up",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class)))})
    public HealthResponse health() {
        boolean running = schedulerService.isRunning();
        boolean alive = schedulerService.isDispatchThreadAlive();
        String status = running && !alive ? "DEGRADED" : "UP";
        return new HealthResponse(status, running, alive, schedulerService.dispatchState());
    }

    public record HealthResponse(String status, @JsonProperty("engine_running") boolean engineRunning,
            @JsonProperty("dispatch_thread_alive") boolean dispatchThreadAlive,
            @JsonProperty("dispatch_state") String dispatchState) {
    }
}
