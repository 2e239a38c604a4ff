package com.acme.editor.runtime.history;

import com.acme.editor.runtime.event.EventDraft;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One undoable user action.
 *
 * @param forwardEvents the events the action appended, in order
 * @param inverseEvents events that undo the action, listed in forward order and applied in
 *     reverse
 * @param recordedAtSequence log head right after the forward events were last appended, by the
 *     action itself or by its latest redo
 */
public record HistoryEntry(
    String description,
    List<EventDraft> forwardEvents,
    List<EventDraft> inverseEvents,
    long recordedAtSequence,
    Instant timestamp) {

  public HistoryEntry {
    Objects.requireNonNull(description, "description");
    forwardEvents = List.copyOf(forwardEvents);
    inverseEvents = List.copyOf(inverseEvents);
    Objects.requireNonNull(timestamp, "timestamp");
  }

  HistoryEntry reappliedAt(long sequence) {
    return new HistoryEntry(description, forwardEvents, inverseEvents, sequence, timestamp);
  }
}
