package com.acme.editor.runtime.event;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic materializations of a {@link Projector}'s state. The store keeps a running projection
 * that the event log advances on every append; {@link #capture} freezes a copy of it.
 *
 * <p>Snapshots only make replay cheaper. Dropping any of them never changes the state a replay
 * produces, as long as the events after the remaining snapshots are still retained.
 */
public class SnapshotStore<S> {
  private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

  public static final int DEFAULT_MAX_SNAPSHOTS = 10;

  private final Projector<S> projector;
  private final int maxSnapshots;
  private final Clock clock;
  private final ConcurrentSkipListMap<Long, Snapshot<S>> snapshots = new ConcurrentSkipListMap<>();

  private S running;
  private long runningSequence;

  public SnapshotStore(Projector<S> projector) {
    this(projector, DEFAULT_MAX_SNAPSHOTS, Clock.systemUTC());
  }

  public SnapshotStore(Projector<S> projector, int maxSnapshots, Clock clock) {
    if (maxSnapshots <= 0) {
      throw new IllegalArgumentException("maxSnapshots must be positive: " + maxSnapshots);
    }
    this.projector = Objects.requireNonNull(projector, "projector");
    this.maxSnapshots = maxSnapshots;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.running = projector.initial();
  }

  public Projector<S> projector() {
    return projector;
  }

  public int maxSnapshots() {
    return maxSnapshots;
  }

  /** Advances the running projection. Called by the log for every event, in sequence order. */
  synchronized void apply(Event event) {
    if (event.sequence() != runningSequence + 1) {
      throw new IllegalStateException(
          "Projection is at " + runningSequence + ", cannot apply event " + event.sequence());
    }
    running = projector.apply(running, event);
    runningSequence = event.sequence();
  }

  /**
   * Replaces the running projection with the state rebuilt from the nearest snapshot and the
   * retained events up to {@code sequence}. Used once a projector failure left it behind the log.
   */
  synchronized void rebuild(EventLog eventLog, long sequence) {
    RestoredState<S> restored = restore(eventLog, sequence);
    running = restored.state();
    runningSequence = sequence;
  }

  /**
   * Stores a copy of the running state as of {@code sequence}, evicting the oldest snapshot once
   * more than {@code maxSnapshots} are held.
   *
   * @throws IllegalStateException if the running projection is not at {@code sequence}
   */
  public synchronized Snapshot<S> capture(long sequence) {
    if (sequence != runningSequence) {
      throw new IllegalStateException(
          "Projection is at " + runningSequence + ", cannot snapshot sequence " + sequence);
    }
    Snapshot<S> snapshot = new Snapshot<>(sequence, projector.copy(running), clock.instant());
    snapshots.put(sequence, snapshot);
    while (snapshots.size() > maxSnapshots) {
      Map.Entry<Long, Snapshot<S>> evicted = snapshots.pollFirstEntry();
      log.debug("Evicted snapshot at sequence {}", evicted.getKey());
    }
    log.debug("Captured snapshot at sequence {}", sequence);
    return snapshot;
  }

  /** The snapshot with the greatest sequence that is {@code <= sequence}. */
  public Optional<Snapshot<S>> nearest(long sequence) {
    Map.Entry<Long, Snapshot<S>> entry = snapshots.floorEntry(sequence);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  public Optional<Snapshot<S>> latest() {
    Map.Entry<Long, Snapshot<S>> entry = snapshots.lastEntry();
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  public List<Snapshot<S>> list() {
    return new ArrayList<>(snapshots.values());
  }

  public void clear() {
    snapshots.clear();
    log.info("Snapshots cleared");
  }

  /** Copy of the running projection, i.e. the state at the log head. */
  public synchronized S currentState() {
    return projector.copy(running);
  }

  public synchronized long currentSequence() {
    return runningSequence;
  }

  /**
   * Rebuilds the state at {@code sequence}: the nearest snapshot at or before it plus the events
   * after that snapshot, or a full replay from the initial state when no snapshot applies.
   *
   * @throws CompactedRangeException if the events the replay needs were pruned
   * @throws IllegalArgumentException if {@code sequence} is negative or past the log head
   */
  public RestoredState<S> restore(EventLog eventLog, long sequence) {
    long head = eventLog.headSequence();
    if (sequence < 0 || sequence > head) {
      throw new IllegalArgumentException(
          "Sequence " + sequence + " is outside the log (head " + head + ")");
    }
    Optional<Snapshot<S>> snapshot = nearest(sequence);
    S state = snapshot.map(s -> projector.copy(s.state())).orElseGet(projector::initial);
    long snapshotSequence = snapshot.map(Snapshot::sequence).orElse(0L);
    return replay(eventLog, state, snapshotSequence, sequence);
  }

  /** Replays every event from the initial state, ignoring snapshots. */
  public RestoredState<S> replayAll(EventLog eventLog) {
    return replayFromStart(eventLog, eventLog.headSequence());
  }

  /**
   * Replays events {@code 1..sequence} from the initial state, ignoring snapshots.
   *
   * @throws CompactedRangeException if the log no longer starts at sequence 1
   */
  public RestoredState<S> replayFromStart(EventLog eventLog, long sequence) {
    return replay(eventLog, projector.initial(), 0L, Math.min(sequence, eventLog.headSequence()));
  }

  private RestoredState<S> replay(EventLog eventLog, S state, long snapshotSequence, long target) {
    List<Event> events =
        target > snapshotSequence ? eventLog.read(snapshotSequence + 1, target) : List.of();
    S current = state;
    for (Event event : events) {
      current = projector.apply(current, event);
    }
    return new RestoredState<>(current, target, snapshotSequence, events.size());
  }
}
