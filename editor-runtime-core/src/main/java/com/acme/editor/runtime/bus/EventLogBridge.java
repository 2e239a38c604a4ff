package com.acme.editor.runtime.bus;

import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.EventLogListener;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every event appended to the log onto the bus, once and in log order. Events appended
 * while the bridge is stopped are not replayed when it starts again.
 */
public class EventLogBridge implements EventLogListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventLogBridge.class);

  private final EventLog eventLog;
  private final EventBus eventBus;
  private boolean started;

  public EventLogBridge(EventLog eventLog, EventBus eventBus) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
  }

  public synchronized void start() {
    if (started) {
      log.warn("Event log bridge already started");
      return;
    }
    eventLog.addListener(this);
    started = true;
    log.info("Event log bridge started at sequence {}", eventLog.headSequence());
  }

  public synchronized void stop() {
    if (!started) {
      return;
    }
    eventLog.removeListener(this);
    started = false;
    log.info("Event log bridge stopped");
  }

  public synchronized boolean isStarted() {
    return started;
  }

  @Override
  public void onAppended(Event event) {
    eventBus.publish(event);
  }

  @Override
  public void close() {
    stop();
  }
}
