/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Poll-based detector comparing a store's modification timestamp with the one seen on the previous probe.
 *
 * <p>
 * The baseline is taken at construction, so the first poll only reports edits made after the detector was created.
 * Appearance and disappearance of the store both count as changes.
 */
public final class ModificationTimeDetector implements ChangeDetector {

    private final String name;
    private final Supplier<Optional<Instant>> probe;
    private Optional<Instant> baseline;

    public ModificationTimeDetector(String name, Supplier<Optional<Instant>> probe) {
        this.name = name;
        this.probe = probe;
        this.baseline = probe.get();
    }

    @Override
    public synchronized boolean hasChanged() {
        Optional<Instant> current = probe.get();
        if (Objects.equals(current, baseline)) {
            return false;
        }
        baseline = current;
        return true;
    }

    @Override
    public String name() {
        return name;
    }
}
