/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.OptionalInt;

import org.jboss.logging.Logger;

import villagecompute.cueclock.data.models.ScheduledJob;

/**
 * Countdown announcements for the next trigger, shown when the runtime {@code debug} flag is on.
 *
 * <p>
 * Tracks the identity of the current earliest job. While that identity is unchanged each threshold (30s, 15s, 5s) is
 * announced at most once; a new identity starts a fresh countdown. When several thresholds are crossed between two
 * observations only the smallest one is announced.
 *
 * <p>
 * Used only from the dispatch loop thread.
 */
public final class NextTriggerAnnouncer {

    private static final Logger LOG = Logger.getLogger(NextTriggerAnnouncer.class);

    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final int[] THRESHOLDS_SECONDS = {30, 15, 5};

    private boolean enabled;
    private JobIdentity current;
    private int lowestAnnounced = Integer.MAX_VALUE;

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Observes the earliest job while the loop waits for it.
     *
     * @return the threshold announced by this call, if any
     */
    public OptionalInt observe(ScheduledJob next, Duration remaining) {
        track(next);
        if (!enabled || remaining.isNegative() || remaining.isZero()) {
            return OptionalInt.empty();
        }
        int crossed = -1;
        for (int threshold : THRESHOLDS_SECONDS) {
            if (remaining.compareTo(Duration.ofSeconds(threshold)) <= 0 && threshold < lowestAnnounced) {
                crossed = threshold;
            }
        }
        if (crossed < 0) {
            return OptionalInt.empty();
        }
        lowestAnnounced = crossed;
        LOG.infof("%ds until next trigger at %s for %s", remaining.getSeconds(), DUE_FORMAT.format(next.due()), next.event());
        return OptionalInt.of(crossed);
    }

    /**
     * Announces the new earliest job once after a firing burst and restarts its countdown.
     *
     * @return whether an announcement was made
     */
    public boolean announceAfterFiring(ScheduledJob next, LocalDateTime now) {
        if (next == null) {
            reset();
            return false;
        }
        current = null;
        track(next);
        Duration remaining = Duration.between(now, next.due());
        if (!enabled || remaining.isNegative() || remaining.isZero()) {
            return false;
        }
        LOG.infof("Next trigger in %ds at %s for %s", remaining.getSeconds(), DUE_FORMAT.format(next.due()),
                next.event());
        return true;
    }

    /**
     * Forgets the tracked job, e.g. after the queue was rebuilt.
     */
    public void reset() {
        current = null;
        lowestAnnounced = Integer.MAX_VALUE;
    }

    private void track(ScheduledJob next) {
        JobIdentity identity = JobIdentity.of(next);
        if (!identity.equals(current)) {
            current = identity;
            lowestAnnounced = Integer.MAX_VALUE;
        }
    }

    private record JobIdentity(long eventId, LocalDateTime occurrence, int triggerIndex, LocalDateTime due) {

        static JobIdentity of(ScheduledJob job) {
            return new JobIdentity(job.event().id(), job.occurrence(), job.triggerIndex(), job.due());
        }
    }
}
