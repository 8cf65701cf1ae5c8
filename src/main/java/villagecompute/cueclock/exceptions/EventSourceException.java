/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.exceptions;

/**
 * Exception thrown when the event store cannot be read, or is still malformed after all read retries.
 *
 * <p>
 * The dispatch loop treats this as a reload failure: it logs, backs off briefly and retries on its next cycle.
 */
public class EventSourceException extends RuntimeException {

    public EventSourceException(String message) {
        super(message);
    }

    public EventSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
