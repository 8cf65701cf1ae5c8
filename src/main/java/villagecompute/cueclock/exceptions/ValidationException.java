/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.exceptions;

/**
 * Exception thrown when request input is invalid (e.g., a trigger index outside the event's trigger list).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
