package com.acme.editor.runtime.history;

import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventDraft;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per event type rules for deriving inverse events. Feature modules register a rule for every
 * undoable event type they append; there is no generic fallback.
 */
public class InverseEventRegistry {
  private static final Logger log = LoggerFactory.getLogger(InverseEventRegistry.class);

  private final Map<String, EventInverter> inverters = new ConcurrentHashMap<>();

  public void register(String type, EventInverter inverter) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(inverter, "inverter");
    if (inverters.putIfAbsent(type, inverter) != null) {
      String error = "Inverse already registered for event type: " + type;
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.debug("Registered inverse for event type: {}", type);
  }

  /** Registers two event types as each other's inverse, keeping the payload. */
  public void registerPair(String type, String inverseType) {
    register(
        type,
        forward ->
            new EventDraft(
                inverseType, forward.payload(), forward.metadata(), forward.aggregate(), null));
    if (!type.equals(inverseType)) {
      register(
          inverseType,
          forward ->
              new EventDraft(type, forward.payload(), forward.metadata(), forward.aggregate(), null));
    }
  }

  public boolean supports(String type) {
    return inverters.containsKey(type);
  }

  /**
   * @throws IllegalArgumentException if no rule exists for the event's type
   */
  public EventDraft invert(Event forward) {
    return requireInverter(forward.type()).invert(forward);
  }

  EventInverter requireInverter(String type) {
    EventInverter inverter = inverters.get(type);
    if (inverter == null) {
      throw new IllegalArgumentException("No inverse registered for event type: " + type);
    }
    return inverter;
  }

  public Set<String> registeredTypes() {
    return new TreeSet<>(inverters.keySet());
  }
}
