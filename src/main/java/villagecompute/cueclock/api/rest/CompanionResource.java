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

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import villagecompute.cueclock.api.types.CompanionStatusType;
import villagecompute.cueclock.services.SchedulerService;

/**
 * REST endpoint probing the button-press service on demand.
 */
@Path("/api/companion")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Companion",
        description = "Button-press service operations")
public class CompanionResource {

    @Inject
    SchedulerService schedulerService;

    @GET
    @Path("/status")
    @Operation(
            summary = "Probe button-press service",
            description = "Actively checks whether the configured Companion instance answers HTTP requests")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Probe completed (see connected)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CompanionStatusType.class)))})
    public CompanionStatusType status() {
        return schedulerService.probeCompanion();
    }
}
