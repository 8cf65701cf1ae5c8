/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

/**
 * Polls the external stores and asks the dispatch loop to reload when one of them changed.
 *
 * <p>
 * Every detector is probed on every pass, even after an earlier one reported a change, so each keeps its baseline
 * current. The watcher never touches the job queue: it only invokes the reload request callback. A failing probe
 * counts as "no change" and is logged at WARN once until it succeeds again.
 *
 * <p>
 * The poll interval is read before every sleep, so a runtime configuration change applies from the next pass.
 */
public final class ReloadWatcher implements Runnable {

    private static final Logger LOG = Logger.getLogger(ReloadWatcher.class);

    private final List<ChangeDetector> detectors;
    private final Runnable reloadRequest;
    private final Supplier<Duration> pollInterval;
    private final StopSignal stopSignal;
    private final Set<String> failing = new HashSet<>();

    public ReloadWatcher(List<ChangeDetector> detectors, Runnable reloadRequest, Supplier<Duration> pollInterval,
            StopSignal stopSignal) {
        this.detectors = List.copyOf(detectors);
        this.reloadRequest = reloadRequest;
        this.pollInterval = pollInterval;
        this.stopSignal = stopSignal;
    }

    @Override
    public void run() {
        LOG.infof("Reload watcher started for %d store(s)", detectors.size());
        try {
            while (!stopSignal.isStopped()) {
                pollOnce();
                if (stopSignal.await(pollInterval.get())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Reload watcher stopped");
    }

    /**
     * Probes every detector once.
     *
     * @return {@code true} if a reload was requested
     */
    public boolean pollOnce() {
        boolean changed = false;
        for (ChangeDetector detector : detectors) {
            try {
                if (detector.hasChanged()) {
                    LOG.debugf("Detected change in %s; scheduling reload", detector.name());
                    changed = true;
                }
                if (failing.remove(detector.name())) {
                    LOG.infof("Probe of %s recovered", detector.name());
                }
            } catch (RuntimeException e) {
                if (failing.add(detector.name())) {
                    LOG.warnf("Probe of %s failed, treating as unchanged: %s", detector.name(), e.getMessage());
                } else {
                    LOG.debugf("Probe of %s still failing: %s", detector.name(), e.getMessage());
                }
            }
        }
        if (changed) {
            reloadRequest.run();
        }
        return changed;
    }
}
