/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One trigger of one event occurrence with its concrete due time.
 *
 * <p>
 * Natural ordering compares {@link #due()} only; the remaining components are payload. Two jobs due at the same second
 * therefore compare as equal even though {@link #equals(Object)} tells them apart.
 *
 * @param due
 *            wall-clock time the trigger fires, truncated to whole seconds
 * @param event
 *            event snapshot the job was expanded from
 * @param occurrence
 *            anchor instant of the occurrence this job belongs to
 * @param triggerIndex
 *            index of the trigger within {@link CalendarEvent#triggers()}
 * @param trigger
 *            the trigger itself
 */
public record ScheduledJob(LocalDateTime due, CalendarEvent event, LocalDateTime occurrence, int triggerIndex,
        Trigger trigger) implements Comparable<ScheduledJob> {

    public ScheduledJob {
        Objects.requireNonNull(due, "due");
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(occurrence, "occurrence");
        Objects.requireNonNull(trigger, "trigger");
    }

    /**
     * Returns whether this job belongs to the given occurrence of the given event.
     */
    public boolean belongsTo(long eventId, LocalDateTime occurrenceInstant) {
        return event.id() == eventId && occurrence.equals(occurrenceInstant);
    }

    @Override
    public int compareTo(ScheduledJob other) {
        return due.compareTo(other.due);
    }
}
