/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import villagecompute.cueclock.data.models.ActionSink;
import villagecompute.cueclock.services.ConnectivityTracker.Transition;

/**
 * Unit tests for {@link ConnectivityTracker}.
 */
class ConnectivityTrackerTest {

    @Test
    void testSinksStartUp() {
        ConnectivityTracker tracker = new ConnectivityTracker();

        assertTrue(tracker.isUp(ActionSink.COMPANION));
        assertTrue(tracker.isUp(ActionSink.LOCAL_API));
        assertEquals(Transition.NONE, tracker.record(ActionSink.COMPANION, true));
    }

    @Test
    void testRepeatedFailuresFlipOnce() {
        ConnectivityTracker tracker = new ConnectivityTracker();

        assertEquals(Transition.WENT_OFFLINE, tracker.record(ActionSink.COMPANION, false));
        assertEquals(Transition.NONE, tracker.record(ActionSink.COMPANION, false));
        assertEquals(Transition.NONE, tracker.record(ActionSink.COMPANION, false));
        assertFalse(tracker.isUp(ActionSink.COMPANION));

        assertEquals(Transition.CAME_ONLINE, tracker.record(ActionSink.COMPANION, true));
        assertEquals(Transition.NONE, tracker.record(ActionSink.COMPANION, true));
    }

    @Test
    void testSinksAreTrackedIndependently() {
        ConnectivityTracker tracker = new ConnectivityTracker();

        tracker.record(ActionSink.LOCAL_API, false);

        assertFalse(tracker.isUp(ActionSink.LOCAL_API));
        assertTrue(tracker.isUp(ActionSink.COMPANION));
    }
}
