/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.cueclock.data.models.ButtonPressAction;
import villagecompute.cueclock.data.models.CalendarEvent;
import villagecompute.cueclock.data.models.InternalCallAction;
import villagecompute.cueclock.data.models.Trigger;
import villagecompute.cueclock.data.models.TriggerAction;
import villagecompute.cueclock.data.models.TriggerKind;
import villagecompute.cueclock.exceptions.EventSourceException;
import villagecompute.cueclock.exceptions.EventValidationException;

/**
 * Event store backed by a JSON file written by the external editor.
 *
 * <p>
 * <b>File format:</b>
 *
 * <pre>
 * [
 *   {
 *     "id": 1, "name": "Sunday service", "day": "Sunday", "date": "2025-01-05", "time": "10:30:00",
 *     "repeating": true, "active": true,
 *     "times": [
 *       {"minutes": 5, "typeOfTrigger": "BEFORE", "actionType": "companion", "buttonURL": "location/1/0/1/press"},
 *       {"minutes": 0, "typeOfTrigger": "AT", "actionType": "api",
 *        "api": {"method": "POST", "path": "/api/scheduler/reload", "body": null}}
 *     ]
 *   }
 * ]
 * </pre>
 *
 * <p>
 * Legacy triggers without {@code actionType} (or {@code action_type}) are treated as {@code api} when they carry an
 * {@code api} object and as {@code companion} otherwise. Events without an integer {@code id} are numbered after the
 * largest id in the file; the number is not written back.
 *
 * <p>
 * The editor may replace the file while it is being read, so parse failures are retried up to {@value #READ_ATTEMPTS}
 * times. A missing file is an empty store.
 */
public class JsonFileEventSource implements EventSource {

    private static final Logger LOG = Logger.getLogger(JsonFileEventSource.class);

    static final int READ_ATTEMPTS = 10;
    static final long RETRY_DELAY_MILLIS = 50;

    private static final String ACTION_COMPANION = "companion";
    private static final String ACTION_API = "api";

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileEventSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CalendarEvent> loadEvents() {
        JsonProcessingException lastParseError = null;
        for (int attempt = 1; attempt <= READ_ATTEMPTS; attempt++) {
            String content;
            try {
                content = Files.readString(path);
            } catch (NoSuchFileException e) {
                LOG.debugf("Event store %s does not exist yet, treating as empty", path);
                return List.of();
            } catch (IOException e) {
                throw new EventSourceException("Failed to read event store " + path, e);
            }

            if (content.isBlank()) {
                LOG.debugf("Event store %s is empty (attempt %d/%d)", path, attempt, READ_ATTEMPTS);
                sleepBeforeRetry();
                continue;
            }
            try {
                return parse(objectMapper.readTree(content));
            } catch (JsonProcessingException e) {
                lastParseError = e;
                LOG.debugf("Event store %s not parseable (attempt %d/%d): %s", path, attempt, READ_ATTEMPTS,
                        e.getOriginalMessage());
                sleepBeforeRetry();
            }
        }
        throw new EventSourceException(
                "Event store " + path + " is still malformed after " + READ_ATTEMPTS + " attempts", lastParseError);
    }

    @Override
    public Optional<Instant> lastModified() {
        try {
            return Optional.of(Files.getLastModifiedTime(path).toInstant());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new EventSourceException("Failed to probe modification time of " + path, e);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }

    public Path getPath() {
        return path;
    }

    List<CalendarEvent> parse(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new EventValidationException("Event store " + path + " must contain a JSON array of events");
        }

        long maxId = 0;
        for (JsonNode node : root) {
            JsonNode id = node.path("id");
            if (id.isIntegralNumber() && id.asLong() > maxId) {
                maxId = id.asLong();
            }
        }

        List<CalendarEvent> events = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            JsonNode idNode = node.path("id");
            long id;
            if (idNode.isIntegralNumber()) {
                id = idNode.asLong();
            } else {
                id = ++maxId;
                LOG.debugf("Event '%s' has no id, assigned %d", node.path("name").asText(""), id);
            }
            events.add(parseEvent(id, node));
        }
        return events;
    }

    private CalendarEvent parseEvent(long id, JsonNode node) {
        String name = node.path("name").asText("");
        String context = "event #" + id + " '" + name + "'";

        DayOfWeek weekday = parseWeekday(node.path("day").asText("Monday"), context);
        LocalDate date;
        LocalTime time;
        try {
            date = LocalDate.parse(node.path("date").asText("1970-01-01"));
        } catch (DateTimeParseException e) {
            throw new EventValidationException("Invalid date for " + context + ": " + node.path("date").asText(), e);
        }
        try {
            time = LocalTime.parse(node.path("time").asText("00:00:00"));
        } catch (DateTimeParseException e) {
            throw new EventValidationException("Invalid time for " + context + ": " + node.path("time").asText(), e);
        }

        List<Trigger> triggers = new ArrayList<>();
        JsonNode times = node.path("times");
        if (!times.isMissingNode() && !times.isNull() && !times.isArray()) {
            throw new EventValidationException("'times' of " + context + " must be an array");
        }
        for (JsonNode trigger : times) {
            triggers.add(parseTrigger(trigger, context));
        }

        return new CalendarEvent(id, name, weekday, date, time, node.path("repeating").asBoolean(false),
                node.path("active").asBoolean(true), triggers);
    }

    private Trigger parseTrigger(JsonNode node, String context) {
        if (!node.isObject()) {
            throw new EventValidationException("Trigger of " + context + " must be an object");
        }
        int minutes = node.path("minutes").asInt(0);
        if (minutes < 0) {
            throw new EventValidationException("Negative trigger offset " + minutes + " in " + context);
        }
        TriggerKind kind = parseKind(node.path("typeOfTrigger").asText("AT"), context);
        boolean enabled = node.path("enabled").asBoolean(true);
        return new Trigger(minutes, kind, parseAction(node, context), enabled);
    }

    private TriggerAction parseAction(JsonNode node, String context) {
        JsonNode api = node.path("api");
        String actionType = node.path("actionType").asText("");
        if (actionType.isBlank()) {
            actionType = node.path("action_type").asText("");
        }
        actionType = actionType.trim().toLowerCase(Locale.ROOT);
        if (actionType.isEmpty()) {
            actionType = api.isObject() ? ACTION_API : ACTION_COMPANION;
        }

        return switch (actionType) {
            case ACTION_COMPANION -> new ButtonPressAction(node.path("buttonURL").asText(""));
            case ACTION_API -> new InternalCallAction(api.path("method").asText(null), api.path("path").asText(""),
                    bodyOf(api.path("body")));
            default -> throw new EventValidationException("Unknown action type '" + actionType + "' in " + context);
        };
    }

    private static String bodyOf(JsonNode body) {
        if (body.isMissingNode() || body.isNull()) {
            return null;
        }
        return body.isTextual() ? body.asText() : body.toString();
    }

    private static DayOfWeek parseWeekday(String value, String context) {
        try {
            return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new EventValidationException("Invalid weekday '" + value + "' for " + context, e);
        }
    }

    private static TriggerKind parseKind(String value, String context) {
        try {
            return TriggerKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new EventValidationException("Invalid trigger type '" + value + "' in " + context, e);
        }
    }

    private static void sleepBeforeRetry() {
        try {
            Thread.sleep(RETRY_DELAY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventSourceException("Interrupted while waiting to re-read the event store");
        }
    }
}
