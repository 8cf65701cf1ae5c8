/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

import villagecompute.cueclock.data.models.CalendarEvent;

/**
 * Computes the occurrence of an event that should be scheduled next.
 *
 * <p>
 * <b>Non-repeating events:</b> the anchor instant is returned while it is still in the future, or while at least one
 * of its triggers is still due in the future (a past anchor with a pending {@code AFTER} trigger stays scheduled).
 *
 * <p>
 * <b>Weekly events:</b> the most recent occurrence of the event's weekday at its anchor time, on or before today and
 * never before the anchor date, is preferred while it is in the future or still owns a pending trigger. Otherwise the
 * occurrence one week later is returned. Preferring the most recent occurrence lets {@code AFTER} triggers fire after
 * the nominal event time without the caller tracking per-occurrence state.
 *
 * <p>
 * Pure function of its arguments; safe to share between threads.
 */
public final class RecurrenceCalculator {

    /**
     * Returns the occurrence to schedule for {@code event} as seen at {@code now}.
     *
     * @param event
     *            event snapshot
     * @param now
     *            reference wall-clock time
     * @return occurrence instant, or empty when a non-repeating event has nothing left to fire
     */
    public Optional<LocalDateTime> nextOccurrence(CalendarEvent event, LocalDateTime now) {
        if (!event.repeating()) {
            LocalDateTime anchor = event.anchorInstant();
            if (anchor.isAfter(now) || event.hasTriggerDueAfter(anchor, now)) {
                return Optional.of(anchor);
            }
            return Optional.empty();
        }

        LocalDateTime candidate = LocalDateTime.of(mostRecentOccurrenceDate(event, now.toLocalDate()),
                event.anchorTime());
        if (candidate.isAfter(now)) {
            return Optional.of(candidate);
        }
        if (event.hasTriggerDueAfter(candidate, now)) {
            return Optional.of(candidate);
        }
        return Optional.of(candidate.plusWeeks(1));
    }

    /**
     * Latest date on or before {@code today} falling on the event's weekday, moved forward to the first matching
     * weekday on or after the anchor date when it would precede it.
     */
    static LocalDate mostRecentOccurrenceDate(CalendarEvent event, LocalDate today) {
        LocalDate date = today.with(TemporalAdjusters.previousOrSame(event.weekday()));
        if (date.isBefore(event.anchorDate())) {
            date = event.anchorDate().with(TemporalAdjusters.nextOrSame(event.weekday()));
        }
        return date;
    }
}
