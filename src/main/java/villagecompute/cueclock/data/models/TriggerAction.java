/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

/**
 * Action bound to a trigger. Implementations are {@link ButtonPressAction} and {@link InternalCallAction}; the concrete
 * variant is fixed when the event store is parsed.
 */
public interface TriggerAction {

    /**
     * Returns the sink this action is executed against.
     */
    ActionSink sink();

    /**
     * Short human-readable form used in logs and upcoming-trigger snapshots.
     */
    String describe();
}
