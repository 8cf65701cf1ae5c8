/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

import java.util.Comparator;
import java.util.Objects;

/**
 * One action bound to a minute offset relative to an event occurrence.
 *
 * @param offsetMinutes
 *            unsigned offset, never negative
 * @param kind
 *            whether the trigger fires before, at or after the occurrence
 * @param action
 *            what to execute when the trigger fires
 * @param enabled
 *            disabled triggers stay in the event but are never queued
 */
public record Trigger(int offsetMinutes, TriggerKind kind, TriggerAction action, boolean enabled) {

    /**
     * Orders triggers by their signed offset, earliest first.
     */
    public static final Comparator<Trigger> BY_SIGNED_OFFSET = Comparator.comparingInt(Trigger::signedOffset);

    public Trigger {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(action, "action");
        if (offsetMinutes < 0) {
            throw new IllegalArgumentException("offsetMinutes must be >= 0, was " + offsetMinutes);
        }
    }

    public Trigger(int offsetMinutes, TriggerKind kind, TriggerAction action) {
        this(offsetMinutes, kind, action, true);
    }

    /**
     * Returns the offset in minutes relative to the occurrence: negative before, zero at, positive after.
     */
    public int signedOffset() {
        return kind.signedOffset(offsetMinutes);
    }
}
