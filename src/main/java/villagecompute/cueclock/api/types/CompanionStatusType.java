/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of an active probe of the button-press service.
 *
 * @param connected
 *            whether the probe succeeded
 * @param baseUrl
 *            address that was probed
 */
@Schema(
        description = "Button-press service probe result")
public record CompanionStatusType(@Schema(
        description = "Whether the probe succeeded",
        required = true) boolean connected,

        @Schema(
                description = "Address that was probed",
                example = "http://127.0.0.1:8888") @JsonProperty("base_url") String baseUrl) {
}
