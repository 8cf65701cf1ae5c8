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
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.cueclock.api.types.ManualTriggerRequestType;
import villagecompute.cueclock.api.types.ManualTriggerResultType;
import villagecompute.cueclock.exceptions.EventSourceException;
import villagecompute.cueclock.exceptions.EventValidationException;
import villagecompute.cueclock.exceptions.ResourceNotFoundException;
import villagecompute.cueclock.exceptions.ValidationException;
import villagecompute.cueclock.services.SchedulerService;

/**
 * REST endpoint for firing an event's trigger on demand.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/events/{id}/trigger} – dispatch one trigger immediately, outside the schedule</li>
 * </ul>
 *
 * <p>
 * The trigger goes through the same dispatcher as scheduled jobs, so sandboxing, connectivity tracking and metrics
 * apply unchanged.
 */
@Path("/api/events")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Events",
        description = "Manual event trigger operations")
public class EventTriggerResource {

    private static final Logger LOG = Logger.getLogger(EventTriggerResource.class);

    @Inject
    SchedulerService schedulerService;

    @POST
    @Path("/{id}/trigger")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Fire a trigger now",
            description = "Dispatch one trigger of an event immediately; which is 1-based and defaults to 1")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Trigger dispatched successfully",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ManualTriggerResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Event has no such trigger",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "404",
                            description = "Event not found",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "503",
                            description = "Action sink unavailable or the action failed",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response trigger(@PathParam("id") long id, ManualTriggerRequestType request) {
        ManualTriggerRequestType body = request != null ? request : new ManualTriggerRequestType(null);
        try {
            ManualTriggerResultType result = schedulerService.triggerNow(id, body.index());
            if (!result.ok()) {
                return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(result).build();
            }
            return Response.ok(result).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (EventSourceException | EventValidationException e) {
            LOG.errorf(e, "Failed to load events for manual trigger of event %d", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Event store unavailable: " + e.getMessage())).build();
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
