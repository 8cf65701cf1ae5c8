/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.testing;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import villagecompute.cueclock.data.models.ButtonPressAction;
import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.Trigger;
import villagecompute.cueclock.data.models.TriggerKind;

/**
 * Builders for events and triggers used across engine tests.
 *
 * <p>
 * Reference week: 2025-01-06 and 2025-01-13 are Mondays.
 */
public final class TestEvents {

    public static final LocalDate FIRST_MONDAY = LocalDate.of(2025, 1, 6);
    public static final LocalDate SECOND_MONDAY = LocalDate.of(2025, 1, 13);
    public static final LocalTime TEN_AM = LocalTime.of(10, 0);

    private TestEvents() {
    }

    public static Trigger before(int minutes) {
        return new Trigger(minutes, TriggerKind.BEFORE, new ButtonPressAction("location/1/0/" + minutes + "/press"));
    }

    public static Trigger at() {
        return new Trigger(0, TriggerKind.AT, new ButtonPressAction("location/1/0/0/press"));
    }

    public static Trigger after(int minutes) {
        return new Trigger(minutes, TriggerKind.AFTER, new ButtonPressAction("location/1/1/" + minutes + "/press"));
    }

    public static Trigger disabled(Trigger trigger) {
        return new Trigger(trigger.offsetMinutes(), trigger.kind(), trigger.action(), false);
    }

    /**
     * Weekly event on the weekday of {@code anchorDate}.
     */
    public static CalendarEvent weekly(long id, LocalDate anchorDate, LocalTime time, Trigger... triggers) {
        return new CalendarEvent(id, "weekly-" + id, anchorDate.getDayOfWeek(), anchorDate, time, true, true,
                List.of(triggers));
    }

    public static CalendarEvent weekly(long id, DayOfWeek weekday, LocalDate anchorDate, LocalTime time,
            Trigger... triggers) {
        return new CalendarEvent(id, "weekly-" + id, weekday, anchorDate, time, true, true, List.of(triggers));
    }

    public static CalendarEvent once(long id, LocalDateTime anchor, Trigger... triggers) {
        return new CalendarEvent(id, "once-" + id, anchor.getDayOfWeek(), anchor.toLocalDate(), anchor.toLocalTime(),
                false, true, List.of(triggers));
    }
}
