package com.acme.editor.runtime.history;

import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventDraft;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An action being recorded through {@link HistoryManager#begin}. Each recorded event is appended
 * right away. Closing a recording that was neither committed nor cancelled cancels it, so
 * try-with-resources rolls back on failure:
 *
 * <pre>{@code
 * try (ActionRecording action = history.begin("Move layer")) {
 *   action.record("layer.moved", payload);
 *   action.commit();
 * }
 * }</pre>
 */
public class ActionRecording implements AutoCloseable {
  private final HistoryManager history;
  private final String description;
  private final List<EventDraft> forward = new ArrayList<>();
  private final List<EventDraft> inverse = new ArrayList<>();
  private boolean finished;

  ActionRecording(HistoryManager history, String description) {
    this.history = history;
    this.description = description;
  }

  public String description() {
    return description;
  }

  /**
   * Appends a forward event; its inverse comes from the {@link InverseEventRegistry}.
   *
   * @throws IllegalArgumentException if the type has no registered inverse; nothing is appended
   */
  public Event record(String type, Object payload) {
    history.checkInvertible(type);
    Event appended = history.appendRecorded(this, EventDraft.of(type, payload));
    forward.add(appended.toDraft());
    inverse.add(history.deriveInverse(type, appended));
    return appended;
  }

  /** Appends a forward event with an explicit inverse. */
  public Event record(EventDraft forwardEvent, EventDraft inverseEvent) {
    Event appended = history.appendRecorded(this, forwardEvent);
    forward.add(forwardEvent);
    inverse.add(inverseEvent);
    return appended;
  }

  public int size() {
    return forward.size();
  }

  /**
   * Pushes the recorded events as one undoable entry and clears the redo stack. An empty
   * recording pushes nothing.
   */
  public Optional<HistoryEntry> commit() {
    Optional<HistoryEntry> entry = history.commitRecording(this, forward, inverse);
    finished = true;
    return entry;
  }

  /** Appends the inverses of everything recorded so far and closes the recording. */
  public void cancel() {
    history.cancelRecording(this, inverse);
    finished = true;
  }

  public boolean isFinished() {
    return finished;
  }

  @Override
  public void close() {
    if (!finished) {
      cancel();
    }
  }
}
