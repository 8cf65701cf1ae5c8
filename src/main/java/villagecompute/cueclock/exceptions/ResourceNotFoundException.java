/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.exceptions;

/**
 * Exception thrown when a requested event does not exist in the store.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
