/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static villagecompute.cueclock.testing.TestEvents.FIRST_MONDAY;
import static villagecompute.cueclock.testing.TestEvents.SECOND_MONDAY;
import static villagecompute.cueclock.testing.TestEvents.TEN_AM;
import static villagecompute.cueclock.testing.TestEvents.after;
import static villagecompute.cueclock.testing.TestEvents.at;
import static villagecompute.cueclock.testing.TestEvents.before;
import static villagecompute.cueclock.testing.TestEvents.once;
import static villagecompute.cueclock.testing.TestEvents.weekly;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.cueclock.config.RuntimeConfig;
import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.ScheduledJob;
import villagecompute.cueclock.observability.SchedulerMetrics;
import villagecompute.cueclock.services.ActionDispatcher;
import villagecompute.cueclock.services.ActionDispatcherFactory;
import villagecompute.cueclock.services.TriggerSnapshotWriter;
import villagecompute.cueclock.testing.FixedRuntimeConfigSource;
import villagecompute.cueclock.testing.InMemoryEventSource;
import villagecompute.cueclock.testing.MutableClock;

/**
 * Unit tests for {@link DispatchLoop}.
 *
 * <p>
 * The loop is driven step by step through its package-private methods with a mutable clock, so no test waits for real
 * due times.
 */
class DispatchLoopTest {

    @Mock
    ActionDispatcher dispatcher;

    private SimpleMeterRegistry registry;
    private SchedulerMetrics metrics;
    private FixedRuntimeConfigSource configSource;
    private AtomicInteger dispatchersCreated;
    private ActionDispatcherFactory factory;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(dispatcher.dispatch(any())).thenReturn(true);
        registry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(registry);
        configSource = new FixedRuntimeConfigSource(RuntimeConfig.defaults());
        dispatchersCreated = new AtomicInteger();
        factory = (config, connectivity) -> {
            dispatchersCreated.incrementAndGet();
            return dispatcher;
        };
    }

    private DispatchLoop loop(InMemoryEventSource events, MutableClock clock) {
        return new DispatchLoop(events, configSource, factory, TriggerSnapshotWriter.disabled(), metrics, clock,
                new StopSignal());
    }

    private double counter(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    @Test
    void testSingleAtTriggerFiveMinutesAhead_queuesExactlyOneJob() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(5), at())), clock);

        assertTrue(loop.reloadNow());

        assertEquals(1, loop.pendingJobs());
        assertEquals(now.plusMinutes(5), loop.upcoming(10).get(0).due());
        assertEquals(1, loop.eventsLoaded());
        assertEquals(now, loop.lastReloadAt());
    }

    @Test
    void testWeeklyEventTwoMinutesBeforeAnchor_queuesAtAndAfterOnly() {
        MutableClock clock = new MutableClock(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 58)));
        DispatchLoop loop = loop(
                new InMemoryEventSource(weekly(1, FIRST_MONDAY, TEN_AM, before(10), at(), after(15))), clock);

        loop.reloadNow();

        List<ScheduledJob> upcoming = loop.upcoming(10);
        assertEquals(2, upcoming.size());
        assertEquals(LocalDateTime.of(SECOND_MONDAY, TEN_AM), upcoming.get(0).due());
        assertEquals(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(10, 15)), upcoming.get(1).due());
    }

    @Test
    void testInactiveEventsAreNotScheduled() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        CalendarEvent active = once(1, now.plusMinutes(5), at());
        CalendarEvent inactive = new CalendarEvent(2, "off", now.getDayOfWeek(), now.toLocalDate(),
                now.toLocalTime().plusMinutes(5), false, false, List.of(at()));
        DispatchLoop loop = loop(new InMemoryEventSource(active, inactive), new MutableClock(now));

        loop.reloadNow();

        assertEquals(1, loop.pendingJobs());
        assertEquals(1, loop.upcoming(10).get(0).event().id());
    }

    @Test
    void testFireDueJobs_dispatchesOnlyDueJobs() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(5), at(), after(10))), clock);
        loop.reloadNow();

        loop.fireDueJobs();
        verify(dispatcher, times(0)).dispatch(any());

        clock.set(now.plusMinutes(5));
        loop.fireDueJobs();
        verify(dispatcher, times(1)).dispatch(any());
        assertEquals(1, loop.pendingJobs());

        clock.set(now.plusHours(1));
        loop.fireDueJobs();
        verify(dispatcher, times(2)).dispatch(any());
        assertEquals(0, loop.pendingJobs());
    }

    @Test
    void testDrainedOccurrenceIsRescheduledExactlyOnce() {
        MutableClock clock = new MutableClock(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 45)));
        DispatchLoop loop = loop(
                new InMemoryEventSource(weekly(1, FIRST_MONDAY, TEN_AM, before(10), at(), after(15))), clock);
        loop.reloadNow();
        assertEquals(3, loop.pendingJobs());

        clock.set(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 50)));
        loop.fireDueJobs();
        clock.set(LocalDateTime.of(SECOND_MONDAY, TEN_AM));
        loop.fireDueJobs();
        assertEquals(1, loop.pendingJobs());
        assertEquals(0.0, counter("cueclock_reschedules_total"));

        clock.set(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(10, 15)));
        loop.fireDueJobs();

        LocalDateTime nextWeek = LocalDateTime.of(SECOND_MONDAY.plusWeeks(1), TEN_AM);
        List<ScheduledJob> upcoming = loop.upcoming(10);
        assertEquals(3, upcoming.size());
        for (ScheduledJob job : upcoming) {
            assertEquals(nextWeek, job.occurrence());
        }
        assertEquals(1.0, counter("cueclock_reschedules_total"));

        // replaying the last job of the drained occurrence must not schedule it again
        ScheduledJob lastOfDrained = new ScheduledJob(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(10, 15)),
                upcoming.get(0).event(), LocalDateTime.of(SECOND_MONDAY, TEN_AM), 2,
                upcoming.get(0).event().triggers().get(2));
        assertFalse(loop.rescheduleIfDrained(lastOfDrained, loop.generation()));
        assertEquals(3, loop.pendingJobs());
        assertEquals(1.0, counter("cueclock_reschedules_total"));
    }

    @Test
    void testNonRepeatingEventIsNotRescheduled() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(1), at())), clock);
        loop.reloadNow();

        clock.set(now.plusMinutes(1));
        loop.fireDueJobs();

        assertEquals(0, loop.pendingJobs());
        assertEquals(0.0, counter("cueclock_reschedules_total"));
    }

    @Test
    void testOccurrenceDrainedAfterLongPause_reschedulesNextFutureWeek() {
        MutableClock clock = new MutableClock(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 59)));
        DispatchLoop loop = loop(new InMemoryEventSource(weekly(1, FIRST_MONDAY, TEN_AM, at())), clock);
        loop.reloadNow();
        assertEquals(1, loop.pendingJobs());

        // host slept through the following Monday
        LocalDateTime resumed = LocalDateTime.of(SECOND_MONDAY.plusDays(8), LocalTime.of(12, 0));
        clock.set(resumed);
        loop.fireDueJobs();

        verify(dispatcher, times(1)).dispatch(any());
        List<ScheduledJob> upcoming = loop.upcoming(10);
        assertEquals(1, upcoming.size());
        assertEquals(LocalDateTime.of(SECOND_MONDAY.plusWeeks(2), TEN_AM), upcoming.get(0).occurrence());
        assertTrue(upcoming.get(0).due().isAfter(resumed));
        assertEquals(1.0, counter("cueclock_reschedules_total"));
    }

    @Test
    void testRebuildWhileDispatchingCancelsReschedule() {
        MutableClock clock = new MutableClock(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 59)));
        InMemoryEventSource events = new InMemoryEventSource(weekly(1, FIRST_MONDAY, TEN_AM, at()));
        DispatchLoop loop = loop(events, clock);
        loop.reloadNow();
        ScheduledJob job = loop.upcoming(1).get(0);
        long poppedGeneration = loop.generation();

        clock.set(LocalDateTime.of(SECOND_MONDAY, LocalTime.of(10, 0, 1)));
        loop.reloadNow();

        assertFalse(loop.rescheduleIfDrained(job, poppedGeneration));
        assertEquals(1, loop.pendingJobs());
        assertEquals(LocalDateTime.of(SECOND_MONDAY.plusWeeks(1), TEN_AM), loop.upcoming(1).get(0).occurrence());
    }

    @Test
    void testRebuildIsDeterministic() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 58));
        InMemoryEventSource events = new InMemoryEventSource(
                weekly(1, FIRST_MONDAY, TEN_AM, before(10), at(), after(15)),
                weekly(2, FIRST_MONDAY.plusDays(2), LocalTime.of(19, 0), before(30), at()),
                once(3, now.plusHours(3), at(), after(5)));

        DispatchLoop first = loop(events, new MutableClock(now));
        DispatchLoop second = loop(events, new MutableClock(now));
        first.reloadNow();
        second.reloadNow();
        first.reloadNow();

        List<LocalDateTime> firstDues = first.upcoming(100).stream().map(ScheduledJob::due).toList();
        List<LocalDateTime> secondDues = second.upcoming(100).stream().map(ScheduledJob::due).toList();
        assertEquals(6, firstDues.size());
        assertEquals(firstDues, secondDues);
    }

    @Test
    void testReloadFailureKeepsPreviousQueue() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        InMemoryEventSource events = new InMemoryEventSource(once(1, now.plusMinutes(5), at()));
        DispatchLoop loop = loop(events, new MutableClock(now));
        loop.reloadNow();

        events.setFailing(true);
        assertFalse(loop.reloadNow());

        assertEquals(1, loop.pendingJobs());
        assertEquals(1.0, registry.get("cueclock_reloads_total").tag("result", "failure").counter().count());
        assertEquals(1.0, registry.get("cueclock_reloads_total").tag("result", "success").counter().count());
    }

    @Test
    void testDispatcherExceptionDoesNotStopFiring() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        when(dispatcher.dispatch(any())).thenThrow(new IllegalStateException("boom")).thenReturn(true);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(1), at(), after(1))), clock);
        loop.reloadNow();

        clock.set(now.plusMinutes(5));
        loop.fireDueJobs();

        verify(dispatcher, times(2)).dispatch(any());
        assertEquals(0, loop.pendingJobs());
    }

    @Test
    void testPendingReloadStopsFiring() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(1), at())), clock);
        loop.reloadNow();

        loop.requestReload();
        clock.set(now.plusMinutes(2));
        loop.fireDueJobs();

        verify(dispatcher, times(0)).dispatch(any());
    }

    @Test
    void testStepReloadsWhenRequested() throws InterruptedException {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        InMemoryEventSource events = new InMemoryEventSource(once(1, now.minusMinutes(1), at()));
        DispatchLoop loop = loop(events, new MutableClock(now));

        loop.step();
        assertEquals(1, events.loads());
        assertEquals(0, loop.pendingJobs());

        events.replace(once(2, now.plusMinutes(1), at()));
        loop.requestReload();
        loop.step();

        assertEquals(2, events.loads());
        assertEquals(1, loop.pendingJobs());
    }

    @Test
    void testStepFiresWhenMinimumIsDue() throws InterruptedException {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        MutableClock clock = new MutableClock(now);
        DispatchLoop loop = loop(new InMemoryEventSource(once(1, now.plusMinutes(1), at())), clock);
        loop.step();

        clock.set(now.plusMinutes(1));
        loop.step();

        verify(dispatcher).dispatch(any());
        assertEquals(LoopState.FIRING, loop.state());
    }

    @Test
    void testChangedRuntimeConfigIsAdoptedOnlyAtReload() {
        LocalDateTime now = LocalDateTime.of(SECOND_MONDAY, LocalTime.of(9, 0));
        DispatchLoop loop = loop(new InMemoryEventSource(), new MutableClock(now));
        loop.reloadNow();
        RuntimeConfig initial = loop.runtimeConfig();
        assertEquals(1, dispatchersCreated.get());

        RuntimeConfig changed = new RuntimeConfig(Duration.ofSeconds(2), Duration.ofSeconds(20), "10.0.0.5", 8000,
                Duration.ofSeconds(3), true);
        configSource.set(changed);
        assertSame(initial, loop.runtimeConfig());

        loop.reloadNow();
        assertNotSame(initial, loop.runtimeConfig());
        assertEquals(changed, loop.runtimeConfig());
        assertEquals(2, dispatchersCreated.get());

        loop.reloadNow();
        assertEquals(2, dispatchersCreated.get());
    }

    @Test
    void testStopEndsRunningLoopPromptly() throws InterruptedException {
        DispatchLoop loop = new DispatchLoop(new InMemoryEventSource(), configSource, factory,
                TriggerSnapshotWriter.disabled(), metrics, Clock.systemDefaultZone(), new StopSignal());
        Thread thread = new Thread(loop, "dispatch-loop-test");
        thread.start();
        Thread.sleep(200);

        loop.stop();
        thread.join(3000);

        assertFalse(thread.isAlive());
        assertEquals(LoopState.STOPPED, loop.state());
    }
}
