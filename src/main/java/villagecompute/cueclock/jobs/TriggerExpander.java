/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.ScheduledJob;
import villagecompute.cueclock.data.models.Trigger;

/**
 * Turns one occurrence of an event into its queued jobs.
 *
 * <p>
 * Each enabled trigger yields a job due at {@code occurrence + signedOffset} minutes, truncated to whole seconds. Jobs
 * that are not strictly in the future are dropped: past triggers of an occurrence are never backfired.
 */
public final class TriggerExpander {

    /**
     * Expands {@code occurrence} of {@code event} into jobs due after {@code now}, in ascending trigger order.
     */
    public List<ScheduledJob> expand(CalendarEvent event, LocalDateTime occurrence, LocalDateTime now) {
        List<Trigger> triggers = event.triggers();
        List<ScheduledJob> jobs = new ArrayList<>(triggers.size());
        for (int index = 0; index < triggers.size(); index++) {
            Trigger trigger = triggers.get(index);
            if (!trigger.enabled()) {
                continue;
            }
            LocalDateTime due = occurrence.plusMinutes(trigger.signedOffset()).truncatedTo(ChronoUnit.SECONDS);
            if (due.isAfter(now)) {
                jobs.add(new ScheduledJob(due, event, occurrence, index, trigger));
            }
        }
        return jobs;
    }
}
