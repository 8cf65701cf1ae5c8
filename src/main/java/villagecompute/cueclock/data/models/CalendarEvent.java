/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of one calendar event as stored by the external editor.
 *
 * <p>
 * Triggers are kept sorted ascending by signed offset, so the last trigger is always the latest one of an occurrence.
 * The sort is stable: triggers sharing an offset keep their stored order.
 *
 * @param id
 *            primary key assigned by the event store
 * @param name
 *            display name
 * @param weekday
 *            weekday a repeating event recurs on
 * @param anchorDate
 *            first date of the event (the only date for non-repeating events)
 * @param anchorTime
 *            wall-clock time of each occurrence
 * @param repeating
 *            whether the event recurs weekly
 * @param active
 *            inactive events are kept in storage but never scheduled
 * @param triggers
 *            triggers of each occurrence
 */
public record CalendarEvent(long id, String name, DayOfWeek weekday, LocalDate anchorDate, LocalTime anchorTime,
        boolean repeating, boolean active, List<Trigger> triggers) {

    public CalendarEvent {
        name = Objects.requireNonNullElse(name, "");
        Objects.requireNonNull(weekday, "weekday");
        Objects.requireNonNull(anchorDate, "anchorDate");
        Objects.requireNonNull(anchorTime, "anchorTime");
        List<Trigger> sorted = new ArrayList<>(Objects.requireNonNullElse(triggers, List.of()));
        sorted.sort(Trigger.BY_SIGNED_OFFSET);
        triggers = List.copyOf(sorted);
    }

    /**
     * Returns the anchor instant: {@code anchorDate} at {@code anchorTime}.
     */
    public LocalDateTime anchorInstant() {
        return LocalDateTime.of(anchorDate, anchorTime);
    }

    /**
     * Returns the largest signed offset among the event's triggers, or zero when it has none.
     */
    public int latestSignedOffset() {
        return triggers.isEmpty() ? 0 : triggers.get(triggers.size() - 1).signedOffset();
    }

    /**
     * Returns whether any enabled trigger of the occurrence is due strictly after {@code now}.
     *
     * @param occurrence
     *            occurrence instant the trigger offsets are applied to
     * @param now
     *            reference time
     */
    public boolean hasTriggerDueAfter(LocalDateTime occurrence, LocalDateTime now) {
        for (Trigger trigger : triggers) {
            if (trigger.enabled() && occurrence.plusMinutes(trigger.signedOffset()).isAfter(now)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "#" + id + " '" + name + "'";
    }
}
