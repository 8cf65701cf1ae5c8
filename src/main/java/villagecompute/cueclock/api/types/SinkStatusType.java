/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Last known connectivity of one action sink.
 *
 * @param sink
 *            sink identifier ({@code COMPANION} or {@code LOCAL_API})
 * @param description
 *            human-readable sink name
 * @param up
 *            whether the most recent attempt against the sink succeeded
 */
@Schema(
        description = "Last known connectivity of an action sink")
public record SinkStatusType(@Schema(
        description = "Sink identifier",
        example = "COMPANION",
        required = true) String sink,

        @Schema(
                description = "Human-readable sink name",
                example = "button-press service") String description,

        @Schema(
                description = "Whether the most recent attempt succeeded",
                required = true) @JsonProperty("up") boolean up) {
}
