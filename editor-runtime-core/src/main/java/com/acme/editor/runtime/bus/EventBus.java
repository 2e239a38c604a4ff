package com.acme.editor.runtime.bus;

import com.acme.editor.runtime.core.EventTypeConstants;
import com.acme.editor.runtime.event.Event;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous in-process publish/subscribe keyed by event type.
 *
 * <p>{@link #publish} delivers to the subscribers present when it starts: first those of the event's
 * type, then wildcard ({@code "*"}) subscribers. A failing handler is logged and reported, and the
 * remaining handlers still run.
 */
public class EventBus {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  public static final int DEFAULT_MAX_LISTENERS = 100;

  private final Map<String, List<Registration>> handlers = new ConcurrentHashMap<>();
  private final Set<String> leakSuspected = ConcurrentHashMap.newKeySet();
  private final int maxListeners;
  private volatile HandlerErrorReporter errorReporter = HandlerErrorReporter.NONE;

  public EventBus() {
    this(DEFAULT_MAX_LISTENERS);
  }

  public EventBus(int maxListeners) {
    if (maxListeners <= 0) {
      throw new IllegalArgumentException("maxListeners must be positive: " + maxListeners);
    }
    this.maxListeners = maxListeners;
  }

  public void setErrorReporter(HandlerErrorReporter errorReporter) {
    this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
  }

  public Subscription subscribe(String type, EventHandler handler) {
    return add(type, handler, false);
  }

  /** Subscribes for the next matching event only. */
  public Subscription once(String type, EventHandler handler) {
    return add(type, handler, true);
  }

  private Subscription add(String type, EventHandler handler, boolean once) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    List<Registration> list = handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
    Registration registration = new Registration(type, handler, once);
    list.add(registration);
    int count = list.size();
    if (count > maxListeners && leakSuspected.add(type)) {
      log.warn(
          "Possible listener leak: {} handlers subscribed to '{}' (max {})",
          count,
          type,
          maxListeners);
    }
    return registration;
  }

  public void publish(Event event) {
    Objects.requireNonNull(event, "event");
    deliver(event, handlers.get(event.type()));
    if (!EventTypeConstants.WILDCARD.equals(event.type())) {
      deliver(event, handlers.get(EventTypeConstants.WILDCARD));
    }
  }

  private void deliver(Event event, List<Registration> registrations) {
    if (registrations == null) {
      return;
    }
    // CopyOnWriteArrayList iteration is over the subscribers present right now
    for (Registration registration : registrations) {
      if (!registration.isActive()) {
        continue;
      }
      if (registration.once && !registration.fired.compareAndSet(false, true)) {
        continue;
      }
      if (registration.once) {
        registration.unsubscribe();
      }
      try {
        registration.handler.handle(event);
      } catch (Exception e) {
        log.warn(
            "Event handler failed for event {} ({})", event.sequence(), event.type(), e);
        reportFailure(event, e);
      }
    }
  }

  private void reportFailure(Event event, Exception error) {
    try {
      errorReporter.report(event, error);
    } catch (Exception e) {
      log.warn("Handler error reporter failed", e);
    }
  }

  public int listenerCount(String type) {
    List<Registration> list = handlers.get(type);
    return list == null ? 0 : list.size();
  }

  public boolean leakSuspected(String type) {
    return leakSuspected.contains(type);
  }

  public int maxListeners() {
    return maxListeners;
  }

  /** Removes every subscriber of one type. */
  public void clear(String type) {
    List<Registration> removed = handlers.remove(type);
    if (removed != null) {
      removed.forEach(r -> r.active = false);
    }
    leakSuspected.remove(type);
  }

  public void clear() {
    handlers.values().forEach(list -> list.forEach(r -> r.active = false));
    handlers.clear();
    leakSuspected.clear();
  }

  private final class Registration implements Subscription {
    private final String type;
    private final EventHandler handler;
    private final boolean once;
    private final AtomicBoolean fired = new AtomicBoolean();
    private volatile boolean active = true;

    private Registration(String type, EventHandler handler, boolean once) {
      this.type = type;
      this.handler = handler;
      this.once = once;
    }

    @Override
    public void unsubscribe() {
      if (!active) {
        return;
      }
      active = false;
      List<Registration> list = handlers.get(type);
      if (list != null) {
        list.remove(this);
      }
    }

    @Override
    public boolean isActive() {
      return active;
    }
  }
}
