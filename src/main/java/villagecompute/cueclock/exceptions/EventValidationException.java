/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.exceptions;

/**
 * Exception thrown when an event record in the store is malformed (unknown weekday or trigger kind, negative offset,
 * unparseable date or time, unknown action type).
 *
 * <p>
 * Raised at load time so malformed triggers never reach the job queue. Extends RuntimeException per project standards.
 */
public class EventValidationException extends RuntimeException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
