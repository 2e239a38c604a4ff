package com.acme.editor.runtime.config;

import java.time.Duration;

/**
 * Tuning for the registry, the event log, the bus and history. Pure POJO - no framework
 * dependencies; hosts bind it from their own configuration source.
 */
public class RuntimeConfig {

  private RegistrySettings registry = new RegistrySettings();
  private EventLogSettings eventLog = new EventLogSettings();
  private EventBusSettings eventBus = new EventBusSettings();
  private HistorySettings history = new HistorySettings();

  public RegistrySettings getRegistry() {
    return registry;
  }

  public void setRegistry(RegistrySettings registry) {
    this.registry = registry;
  }

  public EventLogSettings getEventLog() {
    return eventLog;
  }

  public void setEventLog(EventLogSettings eventLog) {
    this.eventLog = eventLog;
  }

  public EventBusSettings getEventBus() {
    return eventBus;
  }

  public void setEventBus(EventBusSettings eventBus) {
    this.eventBus = eventBus;
  }

  public HistorySettings getHistory() {
    return history;
  }

  public void setHistory(HistorySettings history) {
    this.history = history;
  }

  public static class RegistrySettings {
    private Duration initTimeout = Duration.ofSeconds(10);

    public Duration getInitTimeout() {
      return initTimeout;
    }

    public void setInitTimeout(Duration initTimeout) {
      if (initTimeout == null || initTimeout.isNegative() || initTimeout.isZero()) {
        throw new IllegalArgumentException("initTimeout must be positive: " + initTimeout);
      }
      this.initTimeout = initTimeout;
    }

    public long getInitTimeoutMillis() {
      return initTimeout.toMillis();
    }
  }

  public static class EventLogSettings {
    private int maxEvents = 5000;
    private int snapshotInterval = 1000;
    private int maxSnapshots = 10;

    public int getMaxEvents() {
      return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
      requirePositive("maxEvents", maxEvents);
      this.maxEvents = maxEvents;
    }

    public int getSnapshotInterval() {
      return snapshotInterval;
    }

    public void setSnapshotInterval(int snapshotInterval) {
      requirePositive("snapshotInterval", snapshotInterval);
      this.snapshotInterval = snapshotInterval;
    }

    public int getMaxSnapshots() {
      return maxSnapshots;
    }

    public void setMaxSnapshots(int maxSnapshots) {
      requirePositive("maxSnapshots", maxSnapshots);
      this.maxSnapshots = maxSnapshots;
    }
  }

  public static class EventBusSettings {
    // soft cap, only warns
    private int maxListeners = 100;

    public int getMaxListeners() {
      return maxListeners;
    }

    public void setMaxListeners(int maxListeners) {
      requirePositive("maxListeners", maxListeners);
      this.maxListeners = maxListeners;
    }
  }

  public static class HistorySettings {
    private int maxEntries = 50;

    public int getMaxEntries() {
      return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
      requirePositive("maxEntries", maxEntries);
      this.maxEntries = maxEntries;
    }
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive: " + value);
    }
  }
}
