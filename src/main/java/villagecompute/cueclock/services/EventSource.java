/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import villagecompute.cueclock.data.models.CalendarEvent;

/**
 * Read-only view of the event store maintained by the external editor.
 *
 * <p>
 * Implementations must tolerate being read while the editor rewrites the store.
 */
public interface EventSource {

    /**
     * Loads every stored event, active or not, in store order.
     *
     * @throws villagecompute.cueclock.exceptions.EventSourceException
     *             if the store cannot be read
     * @throws villagecompute.cueclock.exceptions.EventValidationException
     *             if a record is malformed
     */
    List<CalendarEvent> loadEvents();

    /**
     * Loads the events that should be scheduled, in store order.
     */
    default List<CalendarEvent> loadActiveEvents() {
        return loadEvents().stream().filter(CalendarEvent::active).toList();
    }

    /**
     * Returns the store's modification timestamp, or empty when the store does not exist yet.
     */
    Optional<Instant> lastModified();

    /**
     * Short description used in log lines, e.g. the file path.
     */
    String describe();
}
