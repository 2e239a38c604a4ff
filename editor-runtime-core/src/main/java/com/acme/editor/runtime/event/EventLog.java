package com.acme.editor.runtime.event;

import com.acme.editor.runtime.config.RuntimeConfig.EventLogSettings;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only event log, the single source of truth for editor state.
 *
 * <p>Writes are serialized: each append assigns the next sequence, advances the snapshot store's
 * running projection, captures a snapshot every {@code snapshotInterval} events and compacts. Log
 * listeners are notified after the write lock is released, through a queue drained by one thread
 * at a time. Every listener therefore sees each event exactly once and in sequence order, also when
 * a listener appends while being notified.
 *
 * <p>A failing projector never fails the append: the event is stored and published, and snapshots
 * pause until the projection is rebuilt by replay at the next snapshot boundary.
 *
 * <p>Drafts may name an {@link AggregateRef}. Each aggregate carries a version that starts at 1
 * and grows by one per event; a draft with an expected version is rejected with a {@link
 * VersionConflictException} when another writer got there first.
 */
public class EventLog {
  private static final Logger log = LoggerFactory.getLogger(EventLog.class);

  private final int maxEvents;
  private final int snapshotInterval;
  private final SnapshotStore<?> snapshots;
  private final Clock clock;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<Event> events = new ArrayList<>();
  private long head;
  private long firstRetained = 1;
  private boolean projectionStale;
  private final Map<AggregateRef, Long> aggregateVersions = new HashMap<>();

  private final List<EventLogListener> listeners = new CopyOnWriteArrayList<>();
  private final Queue<Event> pendingDelivery = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();

  public EventLog() {
    this(new EventLogSettings());
  }

  public EventLog(EventLogSettings settings) {
    this(
        settings,
        new SnapshotStore<>(new EventTypeCounts(), settings.getMaxSnapshots(), Clock.systemUTC()),
        Clock.systemUTC());
  }

  public EventLog(EventLogSettings settings, SnapshotStore<?> snapshots, Clock clock) {
    this.maxEvents = settings.getMaxEvents();
    this.snapshotInterval = settings.getSnapshotInterval();
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (snapshots.currentSequence() != 0) {
      throw new IllegalArgumentException("Snapshot store already holds a projection");
    }
  }

  // ---------------------------------------------------------------- writes

  public long append(String type, Object payload) {
    return append(EventDraft.of(type, payload));
  }

  public long append(String type, Object payload, EventMetadata metadata) {
    return append(EventDraft.of(type, payload, metadata));
  }

  /** Appends a draft and returns the sequence it was assigned. */
  public long append(EventDraft draft) {
    return appendEvent(draft).sequence();
  }

  /**
   * Appends a draft and returns the stored event.
   *
   * @throws VersionConflictException if the draft expects an aggregate version other than the
   *     current one; nothing is appended in that case
   */
  public Event appendEvent(EventDraft draft) {
    Objects.requireNonNull(draft, "draft");
    Event event;
    lock.writeLock().lock();
    try {
      long version = nextVersion(draft);
      event =
          new Event(
              head + 1,
              draft.type(),
              draft.payload(),
              clock.instant(),
              draft.metadata(),
              draft.aggregate(),
              version);
      events.add(event);
      head = event.sequence();
      if (draft.aggregate() != null) {
        aggregateVersions.put(draft.aggregate(), version);
      }
      pendingDelivery.add(event);
      project(event);
      compact();
    } finally {
      lock.writeLock().unlock();
    }
    log.debug("Appended event {} ({})", event.sequence(), event.type());
    drain();
    return event;
  }

  private long nextVersion(EventDraft draft) {
    AggregateRef aggregate = draft.aggregate();
    if (aggregate == null) {
      return 0;
    }
    long current = aggregateVersions.getOrDefault(aggregate, 0L);
    Long expected = draft.expectedVersion();
    if (expected != null && expected != current) {
      log.warn("Version conflict on {}: expected {}, current {}", aggregate, expected, current);
      throw new VersionConflictException(aggregate, expected, current);
    }
    return current + 1;
  }

  // A failing projector must not undo the write; snapshots pause until a replay rebuilds it.
  private void project(Event event) {
    boolean due = event.sequence() % snapshotInterval == 0;
    try {
      if (projectionStale) {
        if (!due) {
          return;
        }
        snapshots.rebuild(this, event.sequence());
        projectionStale = false;
        log.info("Projection rebuilt by replay at sequence {}", event.sequence());
      } else {
        snapshots.apply(event);
      }
      if (due) {
        snapshots.capture(event.sequence());
      }
    } catch (RuntimeException e) {
      projectionStale = true;
      log.warn(
          "Projection failed at event {} ({}), snapshots paused until the next rebuild",
          event.sequence(),
          event.type(),
          e);
    }
  }

  // Prunes only events already covered by the latest snapshot.
  private void compact() {
    if (events.size() <= maxEvents) {
      return;
    }
    Optional<? extends Snapshot<?>> latest = snapshots.latest();
    if (latest.isEmpty()) {
      return;
    }
    long prunable = latest.get().sequence() - firstRetained + 1;
    int count = (int) Math.min(prunable, events.size() - maxEvents);
    if (count <= 0) {
      return;
    }
    events.subList(0, count).clear();
    firstRetained += count;
    log.debug("Compacted {} events, log now starts at {}", count, firstRetained);
  }

  private void drain() {
    while (!pendingDelivery.isEmpty() && draining.compareAndSet(false, true)) {
      try {
        Event next;
        while ((next = pendingDelivery.poll()) != null) {
          notifyListeners(next);
        }
      } finally {
        draining.set(false);
      }
    }
  }

  private void notifyListeners(Event event) {
    for (EventLogListener listener : listeners) {
      try {
        listener.onAppended(event);
      } catch (Exception e) {
        log.warn("Event log listener failed for event {} ({})", event.sequence(), event.type(), e);
      }
    }
  }

  public void addListener(EventLogListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean removeListener(EventLogListener listener) {
    return listeners.remove(listener);
  }

  // ---------------------------------------------------------------- reads

  /**
   * Events with {@code from <= sequence <= to}, in append order. A {@code to} beyond the head is
   * clamped to the head.
   *
   * @throws CompactedRangeException if part of the range was pruned
   */
  public List<Event> read(long from, long to) {
    lock.readLock().lock();
    try {
      long start = Math.max(from, 1);
      long end = Math.min(to, head);
      if (end < start) {
        return List.of();
      }
      if (start < firstRetained) {
        throw new CompactedRangeException(start, firstRetained);
      }
      int offset = (int) (start - firstRetained);
      return List.copyOf(events.subList(offset, offset + (int) (end - start + 1)));
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Event> readFrom(long from) {
    return read(from, Long.MAX_VALUE);
  }

  /** Every retained event. */
  public List<Event> readAll() {
    lock.readLock().lock();
    try {
      return List.copyOf(events);
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Event> query(EventQuery query) {
    List<Event> result = new ArrayList<>();
    for (Event event : readAll()) {
      if (query.matches(event)) {
        result.add(event);
        if (query.limit() > 0 && result.size() == query.limit()) {
          break;
        }
      }
    }
    return result;
  }

  /** Sequence of the last appended event, 0 when nothing was appended. */
  public long headSequence() {
    lock.readLock().lock();
    try {
      return head;
    } finally {
      lock.readLock().unlock();
    }
  }

  public long firstRetainedSequence() {
    lock.readLock().lock();
    try {
      return firstRetained;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return events.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Current version of an aggregate, 0 when no event of it was appended. */
  public long aggregateVersion(AggregateRef aggregate) {
    lock.readLock().lock();
    try {
      return aggregateVersions.getOrDefault(aggregate, 0L);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Retained events of one aggregate, in version order. */
  public List<Event> aggregateEvents(AggregateRef aggregate) {
    return query(EventQuery.all().withAggregate(aggregate));
  }

  /** Whether the snapshot projection is waiting to be rebuilt after a projector failure. */
  public boolean isProjectionStale() {
    lock.readLock().lock();
    try {
      return projectionStale;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int maxEvents() {
    return maxEvents;
  }

  public int snapshotInterval() {
    return snapshotInterval;
  }

  // ---------------------------------------------------------------- snapshots & replay

  public SnapshotStore<?> snapshots() {
    return snapshots;
  }

  /** Nearest snapshot at or before {@code sequence}. */
  public Optional<? extends Snapshot<?>> snapshotAt(long sequence) {
    return snapshots.nearest(sequence);
  }

  /** State at {@code sequence}, rebuilt from the nearest snapshot. */
  public RestoredState<?> stateAt(long sequence) {
    return snapshots.restore(this, sequence);
  }

  public RestoredState<?> replayAll() {
    return snapshots.replayAll(this);
  }
}
