/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.cueclock.services.SchedulerService;

/**
 * Re-probes the button-press service periodically so a recovered service is noticed (and logged once) without
 * waiting for the next press.
 */
@ApplicationScoped
public class CompanionProbeScheduler {

    private static final Logger LOG = Logger.getLogger(CompanionProbeScheduler.class);

    @Inject
    SchedulerService schedulerService;

    @Scheduled(
            every = "{cueclock.companion.probe-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void probeCompanion() {
        if (!schedulerService.isRunning()) {
            return;
        }
        boolean connected = schedulerService.probeCompanion().connected();
        LOG.debugf("Periodic button-press service probe: %s", connected ? "reachable" : "unreachable");
    }
}
