/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.cueclock.config.RuntimeConfig;

/**
 * Runtime configuration read from the editor's {@code config.json}.
 *
 * <p>
 * Recognized keys: {@code poll_interval}, {@code internal_api_timeout_seconds}, {@code companion_ip},
 * {@code companion_port}, {@code companion_timeout_seconds}, {@code debug}. Everything else in the file belongs to the
 * editor and is ignored. Missing keys fall back to {@link RuntimeConfig} defaults.
 *
 * <p>
 * {@link #refresh()} is called from the reload watcher thread while the dispatch loop reads {@link #current()}, so the
 * snapshot is published through a volatile field.
 */
public class JsonFileRuntimeConfigSource implements RuntimeConfigSource {

    private static final Logger LOG = Logger.getLogger(JsonFileRuntimeConfigSource.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    private volatile RuntimeConfig current;
    private FileTime lastSeenModification;

    public JsonFileRuntimeConfigSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.lastSeenModification = probe();
        RuntimeConfig initial;
        try {
            initial = read();
        } catch (IOException | RuntimeException e) {
            LOG.warnf("Runtime configuration %s is unreadable, using defaults: %s", path, e.getMessage());
            initial = RuntimeConfig.defaults();
        }
        this.current = initial;
    }

    @Override
    public RuntimeConfig current() {
        return current;
    }

    @Override
    public synchronized boolean refresh() {
        FileTime modified = probe();
        if (Objects.equals(modified, lastSeenModification)) {
            return false;
        }
        // recorded even when the read below fails, so a broken file is reported once per edit
        lastSeenModification = modified;

        RuntimeConfig updated;
        try {
            updated = read();
        } catch (IOException | RuntimeException e) {
            LOG.warnf("Ignoring unreadable runtime configuration %s, keeping previous values: %s", path,
                    e.getMessage());
            return false;
        }
        if (updated.equals(current)) {
            return false;
        }
        LOG.infof("Runtime configuration changed: %s", updated);
        current = updated;
        return true;
    }

    public Path getPath() {
        return path;
    }

    private RuntimeConfig read() throws IOException {
        String content;
        try {
            content = Files.readString(path);
        } catch (NoSuchFileException e) {
            return RuntimeConfig.defaults();
        }
        JsonNode root = objectMapper.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IOException("expected a JSON object");
        }
        return new RuntimeConfig(seconds(root, "poll_interval"), seconds(root, "internal_api_timeout_seconds"),
                root.path("companion_ip").asText(null),
                root.path("companion_port").asInt(RuntimeConfig.DEFAULT_COMPANION_PORT),
                seconds(root, "companion_timeout_seconds"), root.path("debug").asBoolean(false));
    }

    private static Duration seconds(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isNumber() && !node.isTextual()) {
            return null;
        }
        double value = node.asDouble(Double.NaN);
        if (Double.isNaN(value)) {
            return null;
        }
        return Duration.ofSeconds(Math.round(value));
    }

    private FileTime probe() {
        try {
            return Files.getLastModifiedTime(path);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.debugf("Could not probe %s: %s", path, e.getMessage());
            return lastSeenModification;
        }
    }
}
