package com.acme.editor.runtime.event;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.acme.editor.runtime.config.RuntimeConfig.EventLogSettings;
import com.acme.editor.runtime.core.Jsons;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for EventLog */
class EventLogTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

  private EventLog eventLog;

  @BeforeEach
  void setUp() {
    eventLog = new EventLog();
  }

  private static EventLog logWith(int maxEvents, int snapshotInterval) {
    EventLogSettings settings = new EventLogSettings();
    settings.setMaxEvents(maxEvents);
    settings.setSnapshotInterval(snapshotInterval);
    return new EventLog(
        settings,
        new SnapshotStore<>(new EventTypeCounts(), settings.getMaxSnapshots(), CLOCK),
        CLOCK);
  }

  @Nested
  @DisplayName("Append Tests")
  class AppendTests {

    @Test
    @DisplayName("append - should assign gapless sequences starting at 1")
    void testSequences() {
      assertThat(eventLog.headSequence()).isZero();

      long first = eventLog.append("layer.added", Map.of("name", "Background"));
      long second = eventLog.append("layer.added", Map.of("name", "Sky"));
      long third = eventLog.append(EventDraft.of("layer.removed", Map.of("name", "Sky")));

      assertThat(List.of(first, second, third)).containsExactly(1L, 2L, 3L);
      assertThat(eventLog.headSequence()).isEqualTo(3);
      assertThat(eventLog.size()).isEqualTo(3);
      assertThat(eventLog.firstRetainedSequence()).isEqualTo(1);
    }

    @Test
    @DisplayName("append - should stamp timestamp and metadata")
    void testTimestampAndMetadata() {
      EventLog fixed = logWith(100, 10);

      Event event =
          fixed.appendEvent(
              EventDraft.of(
                  "filter.applied", Map.of("filter", "blur"), EventMetadata.ai("wf-1")));

      assertThat(event.timestamp()).isEqualTo(CLOCK.instant());
      assertThat(event.metadata().source()).isEqualTo(EventSource.AI);
      assertThat(event.metadata().workflowId()).isEqualTo("wf-1");
      assertThat(fixed.append("layer.added", null)).isEqualTo(2);
    }

    @Test
    @DisplayName("append - stored payload should not change when the caller's copy does")
    void testPayloadImmutability() {
      ObjectNode payload = Jsons.mapper().createObjectNode();
      payload.put("name", "Background");
      eventLog.append("layer.added", payload);

      payload.put("name", "Changed");
      ((ObjectNode) eventLog.readAll().get(0).payload()).put("name", "Also changed");

      assertThat(eventLog.readAll().get(0).payloadText("name")).isEqualTo("Background");
    }
  }

  @Nested
  @DisplayName("Read Tests")
  class ReadTests {

    @BeforeEach
    void fill() {
      for (int i = 1; i <= 5; i++) {
        eventLog.append("stroke", Map.of("index", i));
      }
    }

    @Test
    @DisplayName("read - should be inclusive and ordered")
    void testReadRange() {
      assertThat(eventLog.read(2, 4)).extracting(Event::sequence).containsExactly(2L, 3L, 4L);
      assertThat(eventLog.readFrom(4)).extracting(Event::sequence).containsExactly(4L, 5L);
      assertThat(eventLog.readAll()).hasSize(5);
    }

    @Test
    @DisplayName("read - should clamp past the head and return nothing for empty ranges")
    void testReadBounds() {
      assertThat(eventLog.read(4, 99)).extracting(Event::sequence).containsExactly(4L, 5L);
      assertThat(eventLog.read(6, 10)).isEmpty();
      assertThat(eventLog.read(3, 2)).isEmpty();
    }

    @Test
    @DisplayName("payloadAs - should read the payload as a typed value")
    @SuppressWarnings("unchecked")
    void testPayloadAs() {
      Map<String, Object> payload = eventLog.read(3, 3).get(0).payloadAs(Map.class);

      assertThat(payload).containsEntry("index", 3);
    }
  }

  @Nested
  @DisplayName("Query Tests")
  class QueryTests {

    @Test
    @DisplayName("query - should filter by type, source, workflow, range and limit")
    void testQuery() {
      eventLog.append("layer.added", Map.of("name", "A"));
      eventLog.append("filter.applied", Map.of(), EventMetadata.ai("wf-1"));
      eventLog.append("layer.added", Map.of("name", "B"), EventMetadata.ai("wf-1"));
      eventLog.append("layer.added", Map.of("name", "C"));

      assertThat(eventLog.query(EventQuery.ofTypes("layer.added")))
          .extracting(Event::sequence)
          .containsExactly(1L, 3L, 4L);
      assertThat(eventLog.query(EventQuery.all().withSource(EventSource.AI)))
          .extracting(Event::sequence)
          .containsExactly(2L, 3L);
      assertThat(eventLog.query(EventQuery.ofTypes("layer.added").withWorkflowId("wf-1")))
          .extracting(Event::sequence)
          .containsExactly(3L);
      assertThat(eventLog.query(EventQuery.all().between(2, 4).limit(2)))
          .extracting(Event::sequence)
          .containsExactly(2L, 3L);
    }
  }

  @Nested
  @DisplayName("Listener Tests")
  class ListenerTests {

    @Test
    @DisplayName("listener - should see every event once in log order, also re-entrant appends")
    void testReentrantOrder() {
      List<Long> seen = new ArrayList<>();
      eventLog.addListener(
          event -> {
            if (event.type().equals("layer.added")) {
              eventLog.append("layer.selected", Map.of("name", event.payloadText("name")));
            }
          });
      eventLog.addListener(event -> seen.add(event.sequence()));

      eventLog.append("layer.added", Map.of("name", "A"));
      eventLog.append("layer.added", Map.of("name", "B"));

      assertThat(seen).containsExactly(1L, 2L, 3L, 4L);
      assertThat(eventLog.readAll())
          .extracting(Event::type)
          .containsExactly("layer.added", "layer.selected", "layer.added", "layer.selected");
    }

    @Test
    @DisplayName("listener - failure should not fail the append or other listeners")
    void testListenerFailure() {
      EventLogListener healthy = mock(EventLogListener.class);
      eventLog.addListener(
          event -> {
            throw new IllegalStateException("listener broke");
          });
      eventLog.addListener(healthy);

      assertThatCode(() -> eventLog.append("stroke", Map.of())).doesNotThrowAnyException();
      verify(healthy).onAppended(any(Event.class));
    }

    @Test
    @DisplayName("removeListener - should stop delivery")
    void testRemoveListener() {
      EventLogListener listener = mock(EventLogListener.class);
      eventLog.addListener(listener);
      eventLog.append("stroke", Map.of());

      assertThat(eventLog.removeListener(listener)).isTrue();
      eventLog.append("stroke", Map.of());

      verify(listener, times(1)).onAppended(any(Event.class));
    }
  }

  @Nested
  @DisplayName("Snapshot and Compaction Tests")
  class CompactionTests {

    @Test
    @DisplayName("append - should capture a snapshot every interval")
    void testSnapshotInterval() {
      EventLog small = logWith(100, 5);
      for (int i = 0; i < 12; i++) {
        small.append("stroke", Map.of());
      }

      assertThat(small.snapshots().list()).extracting(Snapshot::sequence).containsExactly(5L, 10L);
      assertThat(small.snapshotAt(9)).hasValueSatisfying(s -> assertThat(s.sequence()).isEqualTo(5));
      assertThat(small.snapshotAt(4)).isEmpty();
    }

    @Test
    @DisplayName("compact - should prune only events covered by the latest snapshot")
    void testCompaction() {
      EventLog small = logWith(10, 5);
      for (int i = 0; i < 12; i++) {
        small.append("stroke", Map.of());
      }

      assertThat(small.size()).isEqualTo(10);
      assertThat(small.firstRetainedSequence()).isEqualTo(3);
      assertThat(small.headSequence()).isEqualTo(12);
      assertThatThrownBy(() -> small.read(1, 5))
          .isInstanceOfSatisfying(
              CompactedRangeException.class,
              e -> assertThat(e.getFirstRetainedSequence()).isEqualTo(3));
    }

    @Test
    @DisplayName("compact - events newer than the latest snapshot are never pruned")
    void testNewerEventsRetained() {
      EventLog small = logWith(3, 5);
      for (int i = 0; i < 4; i++) {
        small.append("stroke", Map.of());
      }
      assertThat(small.size()).isEqualTo(4);

      for (int i = 0; i < 5; i++) {
        small.append("stroke", Map.of());
      }

      // snapshot at 5 covers 1..5, events 6..9 must stay even above the cap
      assertThat(small.firstRetainedSequence()).isEqualTo(6);
      assertThat(small.read(6, 9)).hasSize(4);
      assertThat(small.stateAt(9).state()).isEqualTo(Map.of("stroke", 9L));
    }

    @Test
    @DisplayName("stateAt - should fail when the replay needs pruned events")
    void testStateAtCompacted() {
      EventLog small = logWith(10, 5);
      for (int i = 0; i < 12; i++) {
        small.append("stroke", Map.of());
      }

      assertThatThrownBy(() -> small.stateAt(4)).isInstanceOf(CompactedRangeException.class);
      assertThatThrownBy(small::replayAll).isInstanceOf(CompactedRangeException.class);
      assertThat(small.stateAt(5).eventsReplayed()).isZero();
      assertThat(small.stateAt(12).snapshotSequence()).isEqualTo(10);
    }
  }

  /** Counts events per type but refuses "bad" ones while {@code failing} is set. */
  private static final class FlakyCounts extends EventTypeCounts {
    private boolean failing = true;

    @Override
    public Map<String, Long> apply(Map<String, Long> state, Event event) {
      if (failing && event.type().equals("bad")) {
        throw new IllegalArgumentException("cannot project " + event.type());
      }
      return super.apply(state, event);
    }
  }

  @Nested
  @DisplayName("Projection Failure Tests")
  class ProjectionFailureTests {

    private FlakyCounts projector;
    private SnapshotStore<Map<String, Long>> store;
    private EventLog flaky;
    private List<Long> delivered;

    @BeforeEach
    void setUp() {
      EventLogSettings settings = new EventLogSettings();
      settings.setSnapshotInterval(5);
      projector = new FlakyCounts();
      store = new SnapshotStore<>(projector, 10, CLOCK);
      flaky = new EventLog(settings, store, CLOCK);
      delivered = new ArrayList<>();
      flaky.addListener(event -> delivered.add(event.sequence()));
    }

    @Test
    @DisplayName("append - a failing projector should not fail the append or stop later appends")
    void testProjectorFailureKeepsLogWritable() {
      flaky.append("ok", Map.of());

      long bad = flaky.append("bad", Map.of());
      long next = flaky.append("ok", Map.of());

      assertThat(bad).isEqualTo(2);
      assertThat(next).isEqualTo(3);
      assertThat(flaky.headSequence()).isEqualTo(3);
      assertThat(delivered).containsExactly(1L, 2L, 3L);
      assertThat(flaky.isProjectionStale()).isTrue();
    }

    @Test
    @DisplayName("append - a stale projection should be rebuilt by replay at the next snapshot")
    void testRebuildAtNextSnapshot() {
      flaky.append("ok", Map.of());
      flaky.append("bad", Map.of());
      projector.failing = false;
      flaky.append("ok", Map.of());
      flaky.append("ok", Map.of());
      assertThat(store.list()).isEmpty();

      flaky.append("ok", Map.of());

      assertThat(flaky.isProjectionStale()).isFalse();
      assertThat(store.latest()).map(Snapshot::sequence).contains(5L);
      assertThat(store.latest().get().state()).containsEntry("ok", 4L).containsEntry("bad", 1L);
      assertThat(store.currentState()).isEqualTo(store.replayAll(flaky).state());
    }

    @Test
    @DisplayName("append - a projector that keeps failing should only pause snapshots")
    void testPersistentFailure() {
      flaky.append("bad", Map.of());
      for (int i = 0; i < 11; i++) {
        flaky.append("ok", Map.of());
      }

      assertThat(flaky.headSequence()).isEqualTo(12);
      assertThat(flaky.readAll()).hasSize(12);
      assertThat(delivered).hasSize(12);
      assertThat(store.list()).isEmpty();
      assertThat(flaky.isProjectionStale()).isTrue();
    }
  }

  @Nested
  @DisplayName("Aggregate Tests")
  class AggregateTests {

    private final AggregateRef sky = AggregateRef.of("layer", "sky");
    private final AggregateRef ground = AggregateRef.of("layer", "ground");

    private EventDraft layerEvent(String type, AggregateRef aggregate) {
      return EventDraft.of(type, Map.of("name", aggregate.id())).forAggregate(aggregate);
    }

    @Test
    @DisplayName("append - should number versions per aggregate")
    void testVersions() {
      Event first = eventLog.appendEvent(layerEvent("layer.added", sky));
      eventLog.appendEvent(layerEvent("layer.added", ground));
      Event second = eventLog.appendEvent(layerEvent("layer.moved", sky));
      Event loose = eventLog.appendEvent(EventDraft.of("stroke", Map.of()));

      assertThat(first.version()).isEqualTo(1);
      assertThat(second.version()).isEqualTo(2);
      assertThat(second.aggregate()).isEqualTo(sky);
      assertThat(loose.aggregate()).isNull();
      assertThat(loose.version()).isZero();
      assertThat(eventLog.aggregateVersion(sky)).isEqualTo(2);
      assertThat(eventLog.aggregateVersion(AggregateRef.of("layer", "unknown"))).isZero();
    }

    @Test
    @DisplayName("append - a stale expected version should raise VersionConflictException")
    void testVersionConflict() {
      eventLog.appendEvent(layerEvent("layer.added", sky).expectingVersion(0));
      eventLog.appendEvent(layerEvent("layer.moved", sky).expectingVersion(1));

      assertThatThrownBy(
              () -> eventLog.appendEvent(layerEvent("layer.moved", sky).expectingVersion(1)))
          .isInstanceOf(VersionConflictException.class)
          .hasMessageContaining("layer:sky")
          .satisfies(
              e -> {
                VersionConflictException conflict = (VersionConflictException) e;
                assertThat(conflict.getExpectedVersion()).isEqualTo(1);
                assertThat(conflict.getCurrentVersion()).isEqualTo(2);
              });
      assertThat(eventLog.headSequence()).isEqualTo(2);
      assertThat(eventLog.aggregateVersion(sky)).isEqualTo(2);
    }

    @Test
    @DisplayName("expectingVersion - without an aggregate should be rejected")
    void testExpectedVersionNeedsAggregate() {
      assertThatThrownBy(() -> EventDraft.of("stroke", Map.of()).expectingVersion(0))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("aggregateEvents and query - should filter by aggregate type and id")
    void testAggregateQueries() {
      eventLog.appendEvent(layerEvent("layer.added", sky));
      eventLog.appendEvent(layerEvent("layer.added", ground));
      eventLog.appendEvent(EventDraft.of("selection.changed", Map.of()));
      eventLog.appendEvent(layerEvent("layer.moved", sky));

      assertThat(eventLog.aggregateEvents(sky)).extracting(Event::sequence).containsExactly(1L, 4L);
      assertThat(eventLog.query(EventQuery.all().withAggregateType("layer"))).hasSize(3);
      assertThat(eventLog.query(EventQuery.all().withAggregateType("selection"))).isEmpty();
    }
  }
}
