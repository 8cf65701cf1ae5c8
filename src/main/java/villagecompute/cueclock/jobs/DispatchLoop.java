/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import villagecompute.cueclock.config.RuntimeConfig;
import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.ScheduledJob;
import villagecompute.cueclock.observability.SchedulerMetrics;
import villagecompute.cueclock.services.ActionDispatcher;
import villagecompute.cueclock.services.ActionDispatcherFactory;
import villagecompute.cueclock.services.ConnectivityTracker;
import villagecompute.cueclock.services.EventSource;
import villagecompute.cueclock.services.RuntimeConfigSource;
import villagecompute.cueclock.services.TriggerSnapshotWriter;

/**
 * Control center of the trigger engine: owns the job queue, sleeps until the next job is due or a reload is
 * requested, fires due jobs and advances repeating events once an occurrence has drained.
 *
 * <p>
 * <b>State machine</b> (see {@link LoopState}):
 * <ol>
 * <li>{@code AWAITING_RELOAD}: reread active events, pick each event's occurrence, expand it and rebuild the queue.
 * The runtime configuration is adopted here and nowhere else. A failed reload keeps the previous queue and is retried
 * after a short back-off.</li>
 * <li>{@code IDLE}: queue empty, wait for a reload signal or a short timeout.</li>
 * <li>{@code WAITING}: sleep {@code min(remaining, 1s)} or until signalled. Short sleeps keep the loop responsive to
 * reload signals and wall-clock corrections because due times are always compared against the current time.</li>
 * <li>{@code FIRING}: pop and dispatch every job that is due, stopping at an empty queue, a pending reload or a future
 * minimum.</li>
 * </ol>
 *
 * <p>
 * <b>Rescheduling:</b> after a job of a repeating event fires and no queued job still belongs to the same occurrence,
 * the next occurrence is searched from one second past the occurrence's latest trigger, or from the current time if
 * that is later, and its jobs are pushed. Each
 * drained occurrence is rescheduled at most once, and a rebuild that happened while the job was dispatching cancels
 * the reschedule since the rebuild already picked the right occurrence.
 *
 * <p>
 * <b>Concurrency:</b> queue mutation happens only on this loop's thread while holding {@link #lock}. Other threads
 * may read a copy of the queue or signal a reload through the same lock. Reading the event store, dispatching actions
 * and writing the snapshot all happen outside the lock.
 */
public class DispatchLoop implements Runnable {

    private static final Logger LOG = Logger.getLogger(DispatchLoop.class);

    static final Duration MAX_WAIT = Duration.ofSeconds(1);
    static final Duration IDLE_WAIT = Duration.ofSeconds(1);
    static final Duration RELOAD_BACKOFF = Duration.ofSeconds(1);

    private final EventSource eventSource;
    private final RuntimeConfigSource configSource;
    private final ActionDispatcherFactory dispatcherFactory;
    private final TriggerSnapshotWriter snapshotWriter;
    private final SchedulerMetrics metrics;
    private final Clock clock;
    private final StopSignal stopSignal;

    private final RecurrenceCalculator recurrence = new RecurrenceCalculator();
    private final TriggerExpander expander = new TriggerExpander();
    private final NextTriggerAnnouncer announcer = new NextTriggerAnnouncer();
    private final ConnectivityTracker connectivity = new ConnectivityTracker();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private final JobQueue queue = new JobQueue();
    private final Map<Long, LocalDateTime> drained = new HashMap<>();
    private boolean reloadNeeded = true;
    private long generation;

    private volatile LoopState state = LoopState.AWAITING_RELOAD;
    private volatile RuntimeConfig runtimeConfig;
    private volatile ActionDispatcher dispatcher;
    private volatile LocalDateTime lastReloadAt;
    private volatile int eventsLoaded;

    public DispatchLoop(EventSource eventSource, RuntimeConfigSource configSource,
            ActionDispatcherFactory dispatcherFactory, TriggerSnapshotWriter snapshotWriter, SchedulerMetrics metrics,
            Clock clock, StopSignal stopSignal) {
        this.eventSource = eventSource;
        this.configSource = configSource;
        this.dispatcherFactory = dispatcherFactory;
        this.snapshotWriter = snapshotWriter;
        this.metrics = metrics;
        this.clock = clock;
        this.stopSignal = stopSignal;
        this.runtimeConfig = configSource.current();
        this.dispatcher = dispatcherFactory.create(runtimeConfig, connectivity);
        this.announcer.setEnabled(runtimeConfig.debug());
    }

    @Override
    public void run() {
        LOG.info("Dispatch loop started");
        try {
            while (!stopSignal.isStopped()) {
                step();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = LoopState.STOPPED;
            LOG.info("Dispatch loop stopped");
        }
    }

    /**
     * Runs one pass of the state machine.
     */
    void step() throws InterruptedException {
        if (isReloadNeeded()) {
            if (!reloadNow()) {
                awaitSignal(RELOAD_BACKOFF);
            }
            return;
        }

        lock.lock();
        try {
            if (reloadNeeded || stopSignal.isStopped()) {
                return;
            }
            ScheduledJob next = queue.peekMin();
            if (next == null) {
                state = LoopState.IDLE;
                announcer.reset();
                signal.await(IDLE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                return;
            }
            Duration remaining = Duration.between(now(), next.due());
            if (remaining.compareTo(Duration.ZERO) > 0) {
                state = LoopState.WAITING;
                announcer.observe(next, remaining);
                Duration wait = remaining.compareTo(MAX_WAIT) < 0 ? remaining : MAX_WAIT;
                signal.await(Math.max(1, wait.toMillis()), TimeUnit.MILLISECONDS);
                return;
            }
            state = LoopState.FIRING;
        } finally {
            lock.unlock();
        }
        fireDueJobs();
    }

    /**
     * Rebuilds the queue from the current event and configuration snapshots.
     *
     * @return {@code false} if the event store could not be loaded; the previous queue is kept
     */
    boolean reloadNow() {
        lock.lock();
        try {
            reloadNeeded = false;
            state = LoopState.AWAITING_RELOAD;
        } finally {
            lock.unlock();
        }

        List<CalendarEvent> events;
        try {
            events = eventSource.loadActiveEvents();
        } catch (RuntimeException e) {
            LOG.errorf("Failed to reload events from %s, retrying shortly: %s", eventSource.describe(),
                    e.getMessage());
            metrics.recordReload(false);
            lock.lock();
            try {
                reloadNeeded = true;
            } finally {
                lock.unlock();
            }
            return false;
        }

        adoptRuntimeConfig(configSource.current());

        LocalDateTime now = now();
        List<ScheduledJob> jobs = new ArrayList<>();
        for (CalendarEvent event : events) {
            Optional<LocalDateTime> occurrence = recurrence.nextOccurrence(event, now);
            occurrence.ifPresent(occ -> jobs.addAll(expander.expand(event, occ, now)));
        }

        List<ScheduledJob> upcoming;
        lock.lock();
        try {
            queue.rebuildFrom(jobs);
            generation++;
            drained.clear();
            announcer.reset();
            upcoming = queue.sorted();
            eventsLoaded = events.size();
            lastReloadAt = now;
        } finally {
            lock.unlock();
        }

        LOG.infof("Reloaded %d active event(s) from %s: %d trigger job(s) queued", events.size(),
                eventSource.describe(), upcoming.size());
        if (runtimeConfig.debug()) {
            for (int i = 0; i < Math.min(upcoming.size(), 20); i++) {
                ScheduledJob job = upcoming.get(i);
                LOG.infof("#%02d due=%s | event=%s | offset=%dmin | %s", i + 1, job.due(), job.event(),
                        job.trigger().signedOffset(), job.trigger().action().describe());
            }
        }
        metrics.recordReload(true);
        snapshotWriter.write(upcoming, now);
        return true;
    }

    /**
     * Pops and dispatches every job that is due.
     */
    void fireDueJobs() {
        while (true) {
            ScheduledJob job;
            long poppedGeneration;
            lock.lock();
            try {
                if (reloadNeeded || stopSignal.isStopped()) {
                    return;
                }
                job = queue.peekMin();
                if (job == null || job.due().isAfter(now())) {
                    return;
                }
                queue.popMin();
                poppedGeneration = generation;
            } finally {
                lock.unlock();
            }

            try {
                dispatcher.dispatch(job);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Trigger %d of %s failed; continuing with the next job", job.triggerIndex(),
                        job.event());
            }

            rescheduleIfDrained(job, poppedGeneration);

            lock.lock();
            try {
                if (announcer.isEnabled()) {
                    announcer.announceAfterFiring(queue.peekMin(), now());
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Pushes the next occurrence of {@code job}'s event once its current occurrence has no queued jobs left.
     *
     * @return whether jobs for a new occurrence were pushed
     */
    boolean rescheduleIfDrained(ScheduledJob job, long poppedGeneration) {
        CalendarEvent event = job.event();
        if (!event.repeating()) {
            return false;
        }
        lock.lock();
        try {
            if (generation != poppedGeneration || reloadNeeded) {
                return false;
            }
            if (queue.hasPendingFor(event.id(), job.occurrence())) {
                return false;
            }
            if (job.occurrence().equals(drained.get(event.id()))) {
                return false;
            }
            drained.put(event.id(), job.occurrence());

            // after a long pause the drained occurrence may be weeks behind the clock
            LocalDateTime now = now();
            LocalDateTime floor = job.occurrence().plusMinutes(Math.max(0, event.latestSignedOffset())).plusSeconds(1);
            Optional<LocalDateTime> next = recurrence.nextOccurrence(event, floor.isAfter(now) ? floor : now);
            if (next.isEmpty() || !next.get().isAfter(job.occurrence())) {
                return false;
            }
            if (queue.hasPendingFor(event.id(), next.get())) {
                return false;
            }
            List<ScheduledJob> jobs = expander.expand(event, next.get(), now);
            if (jobs.isEmpty()) {
                LOG.debugf("Next occurrence %s of %s has no trigger left to fire", next.get(), event);
                return false;
            }
            queue.pushAll(jobs);
            metrics.recordReschedule();
            LOG.infof("Rescheduled %s for %s: %d trigger job(s)", event, next.get(), jobs.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the loop to rebuild its queue at the next opportunity and wakes it if it is sleeping.
     */
    public void requestReload() {
        lock.lock();
        try {
            reloadNeeded = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests a cooperative stop and wakes the loop.
     */
    public void stop() {
        stopSignal.stop();
        lock.lock();
        try {
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public LoopState state() {
        return state;
    }

    public int pendingJobs() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns up to {@code limit} queued jobs, earliest first.
     */
    public List<ScheduledJob> upcoming(int limit) {
        List<ScheduledJob> sorted;
        lock.lock();
        try {
            sorted = queue.sorted();
        } finally {
            lock.unlock();
        }
        return sorted.size() <= limit ? sorted : List.copyOf(sorted.subList(0, limit));
    }

    public LocalDateTime lastReloadAt() {
        return lastReloadAt;
    }

    public int eventsLoaded() {
        return eventsLoaded;
    }

    public RuntimeConfig runtimeConfig() {
        return runtimeConfig;
    }

    /**
     * Returns the dispatcher built from the configuration adopted at the last reload.
     */
    public ActionDispatcher dispatcher() {
        return dispatcher;
    }

    public ConnectivityTracker connectivity() {
        return connectivity;
    }

    LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    private boolean isReloadNeeded() {
        lock.lock();
        try {
            return reloadNeeded;
        } finally {
            lock.unlock();
        }
    }

    private void awaitSignal(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (!stopSignal.isStopped()) {
                signal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    private void adoptRuntimeConfig(RuntimeConfig config) {
        if (config.equals(runtimeConfig)) {
            return;
        }
        runtimeConfig = config;
        dispatcher = dispatcherFactory.create(config, connectivity);
        lock.lock();
        try {
            announcer.setEnabled(config.debug());
        } finally {
            lock.unlock();
        }
        LOG.infof("Adopted runtime configuration: companion=%s, internal call timeout=%ss, debug=%s",
                config.companionBaseUrl(), config.internalCallTimeout().getSeconds(), config.debug());
    }
}
