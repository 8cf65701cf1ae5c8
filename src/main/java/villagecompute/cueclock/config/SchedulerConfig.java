/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Bootstrap configuration for the trigger engine.
 *
 * <p>
 * These values are read once at startup from {@code application.properties}. Everything an operator edits while the
 * engine runs lives in the runtime configuration file instead (see {@link RuntimeConfig}).
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code cueclock.events-file} - event store path (default: events.json)</li>
 * <li>{@code cueclock.runtime-config-file} - runtime configuration path (default: config.json)</li>
 * <li>{@code cueclock.snapshot-file} - upcoming-trigger snapshot path (default: calendar_triggers.json)</li>
 * <li>{@code cueclock.local-api.base-url} - origin internal-call actions are sent to</li>
 * <li>{@code cueclock.local-api.prefix} - the only route prefix internal-call actions may reach (default: /api/)</li>
 * <li>{@code cueclock.scheduler.enabled} - start the engine with the application (default: true)</li>
 * </ul>
 *
 * <p>
 * Startup fails when the event store path exists but cannot be opened as a regular readable file. A missing file is
 * fine: it is treated as an empty event list until the editor creates it.
 */
@ApplicationScoped
@Startup
public class SchedulerConfig {

    private static final Logger LOG = Logger.getLogger(SchedulerConfig.class);

    @ConfigProperty(
            name = "cueclock.events-file",
            defaultValue = "events.json")
    String eventsFile;

    @ConfigProperty(
            name = "cueclock.runtime-config-file",
            defaultValue = "config.json")
    String runtimeConfigFile;

    @ConfigProperty(
            name = "cueclock.snapshot-file",
            defaultValue = "calendar_triggers.json")
    String snapshotFile;

    @ConfigProperty(
            name = "cueclock.local-api.base-url",
            defaultValue = "http://127.0.0.1:8080")
    String localApiBaseUrl;

    @ConfigProperty(
            name = "cueclock.local-api.prefix",
            defaultValue = "/api/")
    String localApiPrefix;

    @ConfigProperty(
            name = "cueclock.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    /**
     * Verifies the event store can be opened at all.
     *
     * @throws IllegalStateException
     *             if the event store path is a directory or an unreadable file
     */
    @PostConstruct
    public void validateConfiguration() {
        Path events = eventsPath();
        if (Files.exists(events) && (!Files.isRegularFile(events) || !Files.isReadable(events))) {
            String errorMessage = "Event store " + events.toAbsolutePath()
                    + " exists but is not a readable file. The trigger engine cannot start without an event source.";
            LOG.fatal(errorMessage);
            throw new IllegalStateException(errorMessage);
        }
        LOG.infof("Trigger engine configured: events=%s, runtime config=%s, local API=%s%s", events,
                runtimeConfigPath(), localApiBaseUrl, localApiPrefix);
    }

    public Path eventsPath() {
        return Paths.get(eventsFile);
    }

    public Path runtimeConfigPath() {
        return Paths.get(runtimeConfigFile);
    }

    public Path snapshotPath() {
        return Paths.get(snapshotFile);
    }

    public String localApiBaseUrl() {
        return localApiBaseUrl;
    }

    public String localApiPrefix() {
        return localApiPrefix;
    }

    public boolean enabled() {
        return enabled;
    }
}
