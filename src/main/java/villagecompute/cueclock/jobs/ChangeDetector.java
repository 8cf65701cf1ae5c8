/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.util.function.BooleanSupplier;

/**
 * Detects that an external store changed since the previous probe.
 *
 * <p>
 * Implementations are polled by {@link ReloadWatcher}; a push-based implementation only has to latch a flag and report
 * it on the next poll.
 */
public interface ChangeDetector {

    /**
     * Returns {@code true} once per change. Probe failures may be thrown; the watcher treats them as "no change".
     */
    boolean hasChanged();

    /**
     * Name of the watched store, for log lines.
     */
    String name();

    /**
     * Wraps a probe function as a detector.
     */
    static ChangeDetector of(String name, BooleanSupplier probe) {
        return new ChangeDetector() {

            @Override
            public boolean hasChanged() {
                return probe.getAsBoolean();
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
