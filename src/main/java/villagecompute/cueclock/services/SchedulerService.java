/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.cueclock.api.types.CompanionStatusType;
import villagecompute.cueclock.api.types.ManualTriggerResultType;
import villagecompute.cueclock.api.types.SchedulerStatusType;
import villagecompute.cueclock.api.types.SinkStatusType;
import villagecompute.cueclock.api.types.UpcomingTriggerType;
import villagecompute.cueclock.config.SchedulerConfig;
import villagecompute.cueclock.data.models.ActionSink;
import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.ScheduledJob;
import villagecompute.cueclock.data.models.Trigger;
import villagecompute.cueclock.exceptions.ResourceNotFoundException;
import villagecompute.cueclock.exceptions.ValidationException;
import villagecompute.cueclock.integration.companion.CompanionClient;
import villagecompute.cueclock.integration.localapi.LocalApiClient;
import villagecompute.cueclock.jobs.ChangeDetector;
import villagecompute.cueclock.jobs.DispatchLoop;
import villagecompute.cueclock.jobs.ModificationTimeDetector;
import villagecompute.cueclock.jobs.ReloadWatcher;
import villagecompute.cueclock.jobs.StopSignal;
import villagecompute.cueclock.observability.SchedulerMetrics;

/**
 * Wires the trigger engine together and owns its threads.
 *
 * <p>
 * At startup (when {@code cueclock.scheduler.enabled} is true) two daemon threads are started: the dispatch loop and
 * the reload watcher. Both observe the same {@link StopSignal} and exit cooperatively when the engine is stopped.
 *
 * <p>
 * A stop signal cannot be reset, so {@link #stop()} replaces the loop and watcher with a fresh pair. The next
 * {@link #start()} therefore begins with a full reload. The engine components exist even when the threads are not
 * started, so status queries and manual triggers keep working with the scheduler disabled.
 */
@ApplicationScoped
public class SchedulerService {

    private static final Logger LOG = Logger.getLogger(SchedulerService.class);

    public static final int DEFAULT_UPCOMING_LIMIT = 3;
    public static final int MAX_UPCOMING_LIMIT = 100;

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(3);

    @Inject
    SchedulerConfig schedulerConfig;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    Clock clock = Clock.systemDefaultZone();

    private EventSource eventSource;
    private RuntimeConfigSource configSource;
    private SchedulerMetrics metrics;
    private ActionDispatcherFactory dispatcherFactory;
    private TriggerSnapshotWriter snapshotWriter;
    private volatile DispatchLoop loop;
    private ReloadWatcher watcher;
    private Thread loopThread;
    private Thread watcherThread;
    private volatile boolean running;

    @PostConstruct
    void init() {
        eventSource = new JsonFileEventSource(schedulerConfig.eventsPath(), objectMapper);
        configSource = new JsonFileRuntimeConfigSource(schedulerConfig.runtimeConfigPath(), objectMapper);
        snapshotWriter = new TriggerSnapshotWriter(schedulerConfig.snapshotPath(), objectMapper);

        metrics = new SchedulerMetrics(meterRegistry);
        LocalPathPolicy pathPolicy = new LocalPathPolicy(schedulerConfig.localApiPrefix());
        LocalApiClient localApiClient = new LocalApiClient(schedulerConfig.localApiBaseUrl());
        dispatcherFactory = (config, connectivity) -> new ActionDispatcher(CompanionClient.fromConfig(config),
                localApiClient, pathPolicy, config.internalCallTimeout(), connectivity, metrics, tracer);

        newEngine();
        metrics.registerPendingJobsGauge(() -> loop.pendingJobs());
    }

    private void newEngine() {
        StopSignal stopSignal = new StopSignal();
        DispatchLoop next = new DispatchLoop(eventSource, configSource, dispatcherFactory, snapshotWriter, metrics,
                clock, stopSignal);
        List<ChangeDetector> detectors = List.of(
                new ModificationTimeDetector("event store " + eventSource.describe(), eventSource::lastModified),
                ChangeDetector.of("runtime configuration", configSource::refresh));
        watcher = new ReloadWatcher(detectors, next::requestReload, () -> configSource.current().pollInterval(),
                stopSignal);
        loop = next;
    }

    void onStart(@Observes StartupEvent event) {
        if (!schedulerConfig.enabled()) {
            LOG.info("Trigger engine disabled (cueclock.scheduler.enabled=false); threads not started");
            return;
        }
        start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Starts the dispatch loop and reload watcher threads.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        loopThread = new Thread(loop, "cueclock-dispatch");
        loopThread.setDaemon(true);
        watcherThread = new Thread(watcher, "cueclock-reload-watcher");
        watcherThread.setDaemon(true);
        loopThread.start();
        watcherThread.start();
        running = true;
        LOG.infof("Trigger engine started (events=%s)", eventSource.describe());
    }

    /**
     * Signals both threads to stop, waits briefly for them to exit and prepares a fresh engine for the next start.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        loop.stop();
        try {
            loopThread.join(JOIN_TIMEOUT.toMillis());
            watcherThread.join(JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        running = false;
        newEngine();
        LOG.info("Trigger engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Whether the dispatch thread of the current engine is alive. A stopped engine has no thread.
     */
    public synchronized boolean isDispatchThreadAlive() {
        return running && loopThread != null && loopThread.isAlive();
    }

    public String dispatchState() {
        return loop.state().name();
    }

    public SchedulerStatusType status() {
        List<SinkStatusType> sinks = new ArrayList<>();
        for (ActionSink sink : ActionSink.values()) {
            sinks.add(new SinkStatusType(sink.name(), sink.getDescription(), loop.connectivity().isUp(sink)));
        }
        LocalDateTime lastReload = loop.lastReloadAt();
        return new SchedulerStatusType(running, loop.state().name(), loop.pendingJobs(), loop.eventsLoaded(),
                lastReload == null ? null : lastReload.toString(), eventSource.describe(), sinks);
    }

    /**
     * Returns the next queued jobs, earliest first.
     *
     * @param limit
     *            requested count, clamped to 1..{@value #MAX_UPCOMING_LIMIT}
     */
    public List<UpcomingTriggerType> upcoming(int limit) {
        int clamped = Math.max(1, Math.min(MAX_UPCOMING_LIMIT, limit));
        LocalDateTime now = LocalDateTime.now(clock);
        List<UpcomingTriggerType> result = new ArrayList<>();
        for (ScheduledJob job : loop.upcoming(clamped)) {
            result.add(new UpcomingTriggerType(job.due().toString(), Duration.between(now, job.due()).getSeconds(),
                    job.event().id(), job.event().name(), job.triggerIndex() + 1, job.trigger().signedOffset(),
                    job.trigger().action().sink().name(), job.trigger().action().describe()));
        }
        return result;
    }

    /**
     * Asks the dispatch loop to rebuild its queue.
     */
    public void requestReload() {
        LOG.info("Reload requested through the API");
        loop.requestReload();
    }

    /**
     * Fires one trigger of an event immediately through the current dispatcher.
     *
     * @param eventId
     *            event identifier
     * @param index
     *            zero-based trigger index within the event's trigger list
     * @throws ResourceNotFoundException
     *             if no event has {@code eventId}
     * @throws ValidationException
     *             if the event has no trigger at {@code index}
     */
    public ManualTriggerResultType triggerNow(long eventId, int index) {
        CalendarEvent event = eventSource.loadEvents().stream().filter(e -> e.id() == eventId).findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Event " + eventId + " not found"));
        if (index < 0 || index >= event.triggers().size()) {
            throw new ValidationException(
                    "Event " + eventId + " has " + event.triggers().size() + " trigger(s), no trigger #" + (index + 1));
        }

        Trigger trigger = event.triggers().get(index);
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        ScheduledJob job = new ScheduledJob(now, event, now, index, trigger);
        boolean ok = loop.dispatcher().dispatch(job);
        LOG.infof("Manual trigger #%d of %s -> %s", index + 1, event, ok ? "ok" : "failed");
        return new ManualTriggerResultType(ok, eventId, index + 1, trigger.action().describe());
    }

    /**
     * Actively probes the button-press service.
     */
    public CompanionStatusType probeCompanion() {
        boolean connected = loop.dispatcher().probeButtonPressSink();
        return new CompanionStatusType(connected, loop.runtimeConfig().companionBaseUrl());
    }
}
