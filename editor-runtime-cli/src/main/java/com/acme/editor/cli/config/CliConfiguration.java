package com.acme.editor.cli.config;

import com.acme.editor.runtime.config.RuntimeConfig;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Reads runtime tuning from a {@code .env} file or the process environment.
 */
@Slf4j
public class CliConfiguration {
    private static CliConfiguration instance;
    private final Dotenv dotenv;

    private CliConfiguration() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
        log.info("Configuration loaded successfully");
    }

    CliConfiguration(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            instance = new CliConfiguration();
        }
        return instance;
    }

    private int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                log.warn("Non-positive value for {}: {}, using default: {}", key, value, defaultValue);
            } catch (NumberFormatException e) {
                log.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    // Event log
    public int getMaxEvents() {
        return getInt("EDITOR_MAX_EVENTS", 5000);
    }

    public int getSnapshotInterval() {
        return getInt("EDITOR_SNAPSHOT_INTERVAL", 1000);
    }

    public int getMaxSnapshots() {
        return getInt("EDITOR_MAX_SNAPSHOTS", 10);
    }

    // Event bus
    public int getMaxListeners() {
        return getInt("EDITOR_MAX_LISTENERS", 100);
    }

    // Registry
    public int getInitTimeoutMillis() {
        return getInt("EDITOR_INIT_TIMEOUT_MS", 10_000);
    }

    // History
    public int getMaxHistory() {
        return getInt("EDITOR_MAX_HISTORY", 50);
    }

    public RuntimeConfig toRuntimeConfig() {
        RuntimeConfig config = new RuntimeConfig();
        config.getEventLog().setMaxEvents(getMaxEvents());
        config.getEventLog().setSnapshotInterval(getSnapshotInterval());
        config.getEventLog().setMaxSnapshots(getMaxSnapshots());
        config.getEventBus().setMaxListeners(getMaxListeners());
        config.getRegistry().setInitTimeout(Duration.ofMillis(getInitTimeoutMillis()));
        config.getHistory().setMaxEntries(getMaxHistory());
        return config;
    }
}
