/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.data.models;

import java.util.Locale;
import java.util.Objects;

/**
 * Calls a route of the local API. The path is stored as written by the editor; it is only sandboxed and canonicalized
 * at dispatch time.
 *
 * @param method
 *            HTTP method, upper-cased, {@code POST} when missing
 * @param path
 *            raw route path as stored in the event
 * @param body
 *            optional JSON request body, {@code null} for none
 */
public record InternalCallAction(String method, String path, String body) implements TriggerAction {

    public static final String DEFAULT_METHOD = "POST";

    public InternalCallAction {
        method = method == null || method.isBlank() ? DEFAULT_METHOD : method.trim().toUpperCase(Locale.ROOT);
        path = Objects.requireNonNullElse(path, "").trim();
    }

    @Override
    public ActionSink sink() {
        return ActionSink.LOCAL_API;
    }

    @Override
    public String describe() {
        return method + " " + path;
    }
}
