/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

/**
 * Position of a trigger relative to its event occurrence.
 *
 * <p>
 * The sign applied to a trigger's offset depends only on the kind: {@code BEFORE} fires ahead of the occurrence,
 * {@code AT} fires on it (the offset is ignored), {@code AFTER} fires once the occurrence has passed.
 */
public enum TriggerKind {

    BEFORE,

    AT,

    AFTER;

    /**
     * Applies this kind's sign to an unsigned minute offset.
     *
     * @param offsetMinutes
     *            non-negative offset as stored on the trigger
     * @return signed offset in minutes relative to the occurrence
     */
    public int signedOffset(int offsetMinutes) {
        return switch (this) {
            case BEFORE -> -offsetMinutes;
            case AT -> 0;
            case AFTER -> offsetMinutes;
        };
    }
}
