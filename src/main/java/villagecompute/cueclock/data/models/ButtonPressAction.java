/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

import java.util.Objects;

/**
 * Presses a Companion button, e.g. {@code location/1/0/1/press}.
 *
 * @param url
 *            button path relative to the Companion API root
 */
public record ButtonPressAction(String url) implements TriggerAction {

    public ButtonPressAction {
        url = Objects.requireNonNullElse(url, "").trim();
    }

    @Override
    public ActionSink sink() {
        return ActionSink.COMPANION;
    }

    @Override
    public String describe() {
        return "press '" + url + "'";
    }
}
