/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.exceptions;

/**
 * Exception thrown when an internal-call action targets something other than a route beneath the local API prefix
 * (absolute URLs, scheme or host components, paths escaping the prefix, unsupported methods).
 *
 * <p>
 * Always raised before any network attempt is made.
 */
public class ActionRejectedException extends RuntimeException {

    public ActionRejectedException(String message) {
        super(message);
    }
}
