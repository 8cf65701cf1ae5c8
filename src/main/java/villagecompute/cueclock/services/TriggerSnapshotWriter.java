/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.services;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.cueclock.data.models.ScheduledJob;

/**
 * Writes the queued jobs to a JSON file so other processes (the CLI, the web editor) can show what is coming up.
 *
 * <p>
 * The file is replaced atomically: content goes to a sibling {@code .tmp} file which is then moved over the target.
 * Write failures are logged at WARN and never reach the caller.
 */
public class TriggerSnapshotWriter {

    private static final Logger LOG = Logger.getLogger(TriggerSnapshotWriter.class);

    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path path;
    private final ObjectMapper objectMapper;

    public TriggerSnapshotWriter(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns a writer that discards every snapshot.
     */
    public static TriggerSnapshotWriter disabled() {
        return new TriggerSnapshotWriter(null, null);
    }

    /**
     * Replaces the snapshot file with {@code jobs}, which must already be sorted by due time.
     */
    public void write(List<ScheduledJob> jobs, LocalDateTime now) {
        if (path == null) {
            return;
        }
        List<SnapshotEntry> entries = new ArrayList<>(jobs.size());
        for (ScheduledJob job : jobs) {
            entries.add(new SnapshotEntry(DUE_FORMAT.format(job.due()), Duration.between(now, job.due()).getSeconds(),
                    job.event().name(), job.event().id(), job.triggerIndex(), job.trigger().signedOffset(),
                    job.trigger().action().sink().name(), job.trigger().action().describe()));
        }

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debugf("Wrote %d upcoming trigger(s) to %s", entries.size(), path);
        } catch (IOException e) {
            LOG.warnf("Failed to write trigger snapshot %s: %s", path, e.getMessage());
        }
    }

    public Path getPath() {
        return path;
    }

    public record SnapshotEntry(@JsonProperty("due") String due, @JsonProperty("seconds_until") long secondsUntil,
            @JsonProperty("event") String event, @JsonProperty("event_id") long eventId,
            @JsonProperty("trigger_index") int triggerIndex, @JsonProperty("offset_min") int offsetMinutes,
            @JsonProperty("sink") String sink, @JsonProperty("action") String action) {
    }
}
