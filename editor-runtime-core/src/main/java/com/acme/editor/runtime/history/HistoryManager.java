package com.acme.editor.runtime.history;

import com.acme.editor.runtime.core.EventTypeConstants;
import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventDraft;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.EventMetadata;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undo/redo over the event log. Nothing is ever removed from the log: undo appends the inverse
 * events of the last action followed by a {@code history.undo} marker, and redo appends the
 * forward events again followed by {@code history.redo}.
 *
 * <p>Actions are either recorded in one shot with {@link #recordAction} or incrementally through
 * {@link #begin}; while a recording is open, undo and redo are refused.
 */
public class HistoryManager {
  private static final Logger log = LoggerFactory.getLogger(HistoryManager.class);

  public static final int DEFAULT_MAX_ENTRIES = 50;

  private final EventLog eventLog;
  private final InverseEventRegistry inverses;
  private final int maxEntries;
  private final Clock clock;

  private final Deque<HistoryEntry> undoStack = new ArrayDeque<>();
  private final Deque<HistoryEntry> redoStack = new ArrayDeque<>();
  private ActionRecording recording;

  public HistoryManager(EventLog eventLog, InverseEventRegistry inverses) {
    this(eventLog, inverses, DEFAULT_MAX_ENTRIES, Clock.systemUTC());
  }

  public HistoryManager(
      EventLog eventLog, InverseEventRegistry inverses, int maxEntries, Clock clock) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.inverses = Objects.requireNonNull(inverses, "inverses");
    this.maxEntries = maxEntries;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  // ---------------------------------------------------------------- recording

  /**
   * Opens a recording. Events recorded through it are appended immediately; the action becomes
   * undoable on {@link ActionRecording#commit()}.
   *
   * @throws IllegalStateException if a recording is already open
   */
  public synchronized ActionRecording begin(String description) {
    Objects.requireNonNull(description, "description");
    requireIdle("begin a new action");
    recording = new ActionRecording(this, description);
    log.debug("Recording action: {}", description);
    return recording;
  }

  /**
   * Appends the forward batch and pushes it as one undoable action.
   *
   * @param inverse events undoing the batch, listed in forward order
   */
  public synchronized HistoryEntry recordAction(
      String description, List<EventDraft> forward, List<EventDraft> inverse) {
    requireIdle("record an action");
    requireNotEmpty(forward);
    Objects.requireNonNull(inverse, "inverse");
    forward.forEach(eventLog::append);
    return push(description, forward, inverse);
  }

  /**
   * Appends the forward batch and derives its inverse per event type.
   *
   * @throws IllegalArgumentException if any event type has no registered inverse; nothing is
   *     appended in that case
   */
  public synchronized HistoryEntry recordAction(String description, List<EventDraft> forward) {
    requireIdle("record an action");
    requireNotEmpty(forward);
    forward.forEach(draft -> inverses.requireInverter(draft.type()));
    List<EventDraft> inverse = new ArrayList<>(forward.size());
    for (EventDraft draft : forward) {
      inverse.add(inverses.invert(eventLog.appendEvent(draft)));
    }
    return push(description, forward, inverse);
  }

  synchronized Event appendRecorded(ActionRecording source, EventDraft forward) {
    requireOpen(source);
    return eventLog.appendEvent(forward);
  }

  synchronized EventDraft deriveInverse(String type, Event forward) {
    return inverses.requireInverter(type).invert(forward);
  }

  synchronized void checkInvertible(String type) {
    inverses.requireInverter(type);
  }

  synchronized Optional<HistoryEntry> commitRecording(
      ActionRecording source, List<EventDraft> forward, List<EventDraft> inverse) {
    requireOpen(source);
    recording = null;
    if (forward.isEmpty()) {
      log.debug("Committed empty action: {}", source.description());
      return Optional.empty();
    }
    return Optional.of(push(source.description(), forward, inverse));
  }

  synchronized void cancelRecording(ActionRecording source, List<EventDraft> inverse) {
    requireOpen(source);
    recording = null;
    appendInverse(inverse);
    eventLog.append(marker(EventTypeConstants.HISTORY_CANCELLED, source.description(), 0));
    log.info("Cancelled action: {}", source.description());
  }

  private void requireOpen(ActionRecording source) {
    if (recording != source) {
      String error = "Recording '" + source.description() + "' is no longer open";
      log.error(error);
      throw new IllegalStateException(error);
    }
  }

  // Version checks guard the first append only; undo and redo replay unconditionally.
  private HistoryEntry push(String description, List<EventDraft> forward, List<EventDraft> inverse) {
    HistoryEntry entry =
        new HistoryEntry(
            description,
            withoutVersionChecks(forward),
            withoutVersionChecks(inverse),
            eventLog.headSequence(),
            clock.instant());
    pushUndo(entry);
    redoStack.clear();
    log.debug("Recorded action: {} ({} events)", description, forward.size());
    return entry;
  }

  private static List<EventDraft> withoutVersionChecks(List<EventDraft> drafts) {
    return drafts.stream().map(EventDraft::withoutVersionCheck).toList();
  }

  private void pushUndo(HistoryEntry entry) {
    undoStack.push(entry);
    while (undoStack.size() > maxEntries) {
      HistoryEntry dropped = undoStack.removeLast();
      log.debug("History full, dropped oldest action: {}", dropped.description());
    }
  }

  // ---------------------------------------------------------------- undo / redo

  /**
   * @return {@code false} when there is nothing to undo
   * @throws IllegalStateException while an action is being recorded
   */
  public synchronized boolean undo() {
    requireIdle("undo");
    HistoryEntry entry = undoStack.poll();
    if (entry == null) {
      return false;
    }
    appendInverse(entry.inverseEvents());
    eventLog.append(
        marker(EventTypeConstants.HISTORY_UNDO, entry.description(), entry.recordedAtSequence()));
    redoStack.push(entry);
    log.debug("Undid action: {}", entry.description());
    return true;
  }

  /**
   * @return {@code false} when there is nothing to redo
   * @throws IllegalStateException while an action is being recorded
   */
  public synchronized boolean redo() {
    requireIdle("redo");
    HistoryEntry entry = redoStack.poll();
    if (entry == null) {
      return false;
    }
    entry.forwardEvents().forEach(eventLog::append);
    HistoryEntry reapplied = entry.reappliedAt(eventLog.headSequence());
    eventLog.append(
        marker(
            EventTypeConstants.HISTORY_REDO, entry.description(), reapplied.recordedAtSequence()));
    pushUndo(reapplied);
    log.debug("Redid action: {}", entry.description());
    return true;
  }

  /**
   * Undoes or redoes one step at a time until {@code target} is the latest applied action, then
   * appends a {@code history.navigated} marker.
   *
   * @return the number of steps taken, negative for undo and positive for redo
   * @throws IllegalArgumentException if {@code target} is on neither stack
   * @throws IllegalStateException while an action is being recorded
   */
  public synchronized int navigateTo(HistoryEntry target) {
    Objects.requireNonNull(target, "target");
    requireIdle("navigate history");
    int undoIndex = indexOf(undoStack, target);
    int steps;
    if (undoIndex >= 0) {
      for (int i = 0; i < undoIndex; i++) {
        undo();
      }
      steps = -undoIndex;
    } else {
      int redoIndex = indexOf(redoStack, target);
      if (redoIndex < 0) {
        String error = "Action is not in the history: " + target.description();
        log.error(error);
        throw new IllegalArgumentException(error);
      }
      for (int i = 0; i <= redoIndex; i++) {
        redo();
      }
      steps = redoIndex + 1;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("description", target.description());
    payload.put("direction", steps < 0 ? "undo" : steps > 0 ? "redo" : "none");
    payload.put("steps", Math.abs(steps));
    eventLog.append(EventTypeConstants.HISTORY_NAVIGATED, payload, EventMetadata.system());
    log.debug("Navigated {} steps to action: {}", steps, target.description());
    return steps;
  }

  private static int indexOf(Deque<HistoryEntry> stack, HistoryEntry target) {
    int index = 0;
    for (HistoryEntry entry : stack) {
      if (entry == target) {
        return index;
      }
      index++;
    }
    return -1;
  }

  private void appendInverse(List<EventDraft> inverse) {
    for (int i = inverse.size() - 1; i >= 0; i--) {
      eventLog.append(inverse.get(i));
    }
  }

  private static EventDraft marker(String type, String description, long recordedAtSequence) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("description", description);
    if (recordedAtSequence > 0) {
      payload.put("recordedAtSequence", recordedAtSequence);
    }
    return EventDraft.of(type, payload, EventMetadata.system());
  }

  // ---------------------------------------------------------------- inspection

  public synchronized boolean canUndo() {
    return recording == null && !undoStack.isEmpty();
  }

  public synchronized boolean canRedo() {
    return recording == null && !redoStack.isEmpty();
  }

  public synchronized int undoDepth() {
    return undoStack.size();
  }

  public synchronized int redoDepth() {
    return redoStack.size();
  }

  public synchronized HistoryState state() {
    return recording == null ? HistoryState.IDLE : HistoryState.RECORDING;
  }

  /** Undoable entries, oldest first. */
  public synchronized List<HistoryEntry> entries() {
    List<HistoryEntry> result = new ArrayList<>(undoStack);
    Collections.reverse(result);
    return result;
  }

  /** Redoable entries, next redo first. */
  public synchronized List<HistoryEntry> redoEntries() {
    return new ArrayList<>(redoStack);
  }

  public int maxEntries() {
    return maxEntries;
  }

  /** Both stacks and the log head, read atomically. */
  synchronized HistoryPosition capturePosition() {
    return new HistoryPosition(
        eventLog.headSequence(), List.copyOf(undoStack), List.copyOf(redoStack));
  }

  /**
   * Puts both stacks back the way {@code position} saw them. The log keeps every event.
   *
   * @throws IllegalStateException while an action is being recorded
   */
  synchronized void restorePosition(HistoryPosition position) {
    requireIdle("restore history");
    undoStack.clear();
    undoStack.addAll(position.undoEntries());
    redoStack.clear();
    redoStack.addAll(position.redoEntries());
    log.debug(
        "Restored history to sequence {} (undo {}, redo {})",
        position.headSequence(),
        undoStack.size(),
        redoStack.size());
  }

  public synchronized void clear() {
    undoStack.clear();
    redoStack.clear();
    log.info("History cleared");
  }

  /**
   * Drops every undo and redo entry recorded after {@code sequence}. The log keeps their events.
   *
   * @return number of entries dropped
   * @throws IllegalStateException while an action is being recorded
   */
  public synchronized int truncateAfter(long sequence) {
    requireIdle("truncate history");
    int dropped = removeAfter(undoStack, sequence) + removeAfter(redoStack, sequence);
    if (dropped > 0) {
      log.info("Dropped {} history entries recorded after sequence {}", dropped, sequence);
    }
    return dropped;
  }

  private static int removeAfter(Deque<HistoryEntry> stack, long sequence) {
    int removed = 0;
    for (Iterator<HistoryEntry> it = stack.iterator(); it.hasNext(); ) {
      if (it.next().recordedAtSequence() > sequence) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  private void requireIdle(String operation) {
    if (recording != null) {
      String error =
          "Cannot " + operation + " while recording '" + recording.description() + "'";
      log.error(error);
      throw new IllegalStateException(error);
    }
  }

  private static void requireNotEmpty(List<EventDraft> forward) {
    if (forward == null || forward.isEmpty()) {
      throw new IllegalArgumentException("An action needs at least one forward event");
    }
  }
}
