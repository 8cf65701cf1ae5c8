/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.observability;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;
import villagecompute.cueclock.data.models.ActionSink;

/**
 * Custom metrics for the trigger engine.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code cueclock_jobs_pending} - Jobs currently in the queue</li>
 * <li><b>Counter:</b> {@code cueclock_reloads_total{result}} - Queue rebuilds, {@code success} or {@code failure}</li>
 * <li><b>Counter:</b> {@code cueclock_dispatch_total{sink,result}} - Action attempts, result is {@code success},
 * {@code failure}, {@code rejected} or {@code skipped}</li>
 * <li><b>Counter:</b> {@code cueclock_sink_transitions_total{sink,state}} - Connectivity flips, state is
 * {@code offline} or {@code online}</li>
 * <li><b>Counter:</b> {@code cueclock_reschedules_total} - Repeating events advanced to their next week</li>
 * <li><b>Timer:</b> {@code cueclock_dispatch_duration{sink}} - Time spent per action attempt</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}. Meters are looked up through the registry on each call, so the
 * same instance can be shared by successive dispatchers after a configuration reload.
 */
public class SchedulerMetrics {

    private static final Logger LOG = Logger.getLogger(SchedulerMetrics.class);

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_FAILURE = "failure";
    public static final String RESULT_REJECTED = "rejected";
    public static final String RESULT_SKIPPED = "skipped";

    private final MeterRegistry registry;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the pending-jobs gauge against a live source.
     *
     * @param pendingJobs
     *            supplier of the current queue size
     */
    public void registerPendingJobsGauge(Supplier<Number> pendingJobs) {
        Gauge.builder("cueclock_jobs_pending", pendingJobs).description("Trigger jobs waiting in the queue")
                .register(registry);
        LOG.debug("Registered gauge: cueclock_jobs_pending");
    }

    public void recordReload(boolean success) {
        Counter.builder("cueclock_reloads_total").description("Job queue rebuilds from the event store")
                .tag("result", success ? RESULT_SUCCESS : RESULT_FAILURE).register(registry).increment();
    }

    public void recordDispatch(ActionSink sink, String result) {
        Counter.builder("cueclock_dispatch_total").description("Trigger action attempts")
                .tag("sink", sinkTag(sink)).tag("result", result).register(registry).increment();
    }

    public void recordDispatchDuration(ActionSink sink, Duration elapsed) {
        Timer.builder("cueclock_dispatch_duration").description("Time spent per trigger action attempt")
                .tag("sink", sinkTag(sink)).register(registry).record(elapsed);
    }

    public void recordTransition(ActionSink sink, boolean online) {
        Counter.builder("cueclock_sink_transitions_total").description("Action sink connectivity state changes")
                .tag("sink", sinkTag(sink)).tag("state", online ? "online" : "offline").register(registry)
                .increment();
    }

    public void recordReschedule() {
        Counter.builder("cueclock_reschedules_total").description("Repeating events advanced to their next occurrence")
                .register(registry).increment();
    }

    private static String sinkTag(ActionSink sink) {
        return sink.name().toLowerCase(Locale.ROOT);
    }
}
