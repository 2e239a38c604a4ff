package com.acme.editor.runtime.history;

import com.acme.editor.runtime.core.EventTypeConstants;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.EventMetadata;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named bookmarks for logical revert. Reverting never truncates the log; it puts the undo and redo
 * stacks back the way they were when the checkpoint was taken, discards the checkpoints created
 * after it and appends a {@code checkpoint.reverted} marker so bus subscribers can rebuild.
 *
 * <p>The registry's monitor only guards its own map. History and the log are called outside it,
 * so bus handlers running under the history manager's lock may create checkpoints freely.
 */
public class CheckpointRegistry {
  private static final Logger log = LoggerFactory.getLogger(CheckpointRegistry.class);

  private final EventLog eventLog;
  private final HistoryManager history;
  private final Clock clock;
  private final Map<String, Bookmark> bookmarks = new LinkedHashMap<>();
  private final List<CheckpointListener> listeners = new CopyOnWriteArrayList<>();

  public CheckpointRegistry(EventLog eventLog, HistoryManager history) {
    this(eventLog, history, Clock.systemUTC());
  }

  public CheckpointRegistry(EventLog eventLog, HistoryManager history, Clock clock) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    this.history = Objects.requireNonNull(history, "history");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Bookmarks the current log head. An existing checkpoint with the same id is replaced. */
  public Checkpoint createCheckpoint(String id) {
    Objects.requireNonNull(id, "id");
    HistoryPosition position = history.capturePosition();
    Checkpoint checkpoint = new Checkpoint(id, position.headSequence(), clock.instant());
    synchronized (this) {
      bookmarks.remove(id);
      bookmarks.put(id, new Bookmark(checkpoint, position));
    }
    log.info("Created checkpoint '{}' at sequence {}", id, checkpoint.sequence());
    return checkpoint;
  }

  /**
   * Returns to a checkpoint.
   *
   * @return {@code true} if events other than this registry's own revert markers had been
   *     appended since the checkpoint
   * @throws CheckpointNotFoundException if no checkpoint has that id
   * @throws IllegalStateException while an action is being recorded
   */
  public boolean revertToCheckpoint(String id) {
    Bookmark bookmark;
    synchronized (this) {
      bookmark = bookmarks.get(id);
    }
    if (bookmark == null) {
      throw new CheckpointNotFoundException(id);
    }
    Checkpoint checkpoint = bookmark.checkpoint;
    history.restorePosition(bookmark.position);
    boolean progressDiscarded = eventLog.headSequence() > bookmark.settledAt();

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("checkpointId", id);
    payload.put("sequence", checkpoint.sequence());
    long marker =
        eventLog.append(EventTypeConstants.CHECKPOINT_REVERTED, payload, EventMetadata.system());

    long cut = checkpoint.sequence();
    synchronized (this) {
      bookmarks.values().removeIf(b -> b.checkpoint.sequence() > cut);
      bookmark.settle(marker);
    }
    log.info("Reverted to checkpoint '{}' at sequence {}", id, checkpoint.sequence());
    for (CheckpointListener listener : listeners) {
      listener.onReverted(checkpoint, progressDiscarded);
    }
    return progressDiscarded;
  }

  /** Checkpoints ordered by sequence. */
  public synchronized List<Checkpoint> listCheckpoints() {
    List<Checkpoint> result = new ArrayList<>();
    bookmarks.values().forEach(b -> result.add(b.checkpoint));
    result.sort(Comparator.comparingLong(Checkpoint::sequence));
    return result;
  }

  public synchronized Optional<Checkpoint> getCheckpoint(String id) {
    Bookmark bookmark = bookmarks.get(id);
    return bookmark == null ? Optional.empty() : Optional.of(bookmark.checkpoint);
  }

  public synchronized boolean deleteCheckpoint(String id) {
    boolean removed = bookmarks.remove(id) != null;
    if (removed) {
      log.info("Deleted checkpoint '{}'", id);
    }
    return removed;
  }

  public void addListener(CheckpointListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(CheckpointListener listener) {
    listeners.remove(listener);
  }

  // Checkpoint plus the history it restores. settledAt is the head once the latest revert to it
  // finished, so its own marker does not count as progress.
  private static final class Bookmark {
    private final Checkpoint checkpoint;
    private final HistoryPosition position;
    private long settledAt;

    Bookmark(Checkpoint checkpoint, HistoryPosition position) {
      this.checkpoint = checkpoint;
      this.position = position;
      this.settledAt = checkpoint.sequence();
    }

    synchronized long settledAt() {
      return settledAt;
    }

    synchronized void settle(long sequence) {
      settledAt = Math.max(settledAt, sequence);
    }
  }
}
