package com.acme.editor.runtime.history;

import static com.acme.editor.runtime.event.LayerListProjector.LAYER_ADDED;
import static com.acme.editor.runtime.event.LayerListProjector.LAYER_REMOVED;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.editor.runtime.core.EventTypeConstants;
import com.acme.editor.runtime.event.Event;
import com.acme.editor.runtime.event.EventDraft;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.EventQuery;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for CheckpointRegistry */
class CheckpointRegistryTest {

  private EventLog eventLog;
  private HistoryManager history;
  private CheckpointRegistry checkpoints;

  @BeforeEach
  void setUp() {
    eventLog = new EventLog();
    InverseEventRegistry inverses = new InverseEventRegistry();
    inverses.registerPair(LAYER_ADDED, LAYER_REMOVED);
    history = new HistoryManager(eventLog, inverses);
    checkpoints = new CheckpointRegistry(eventLog, history);
  }

  private void addLayer(String name) {
    history.recordAction(
        "Add " + name, List.of(EventDraft.of(LAYER_ADDED, Map.of("name", name))));
  }

  @Nested
  @DisplayName("Revert Tests")
  class RevertTests {

    @Test
    @DisplayName("revert - should restore the undo stack and keep the events in the log")
    void testCheckpointLaw() {
      addLayer("Background");
      addLayer("Sky");
      checkpoints.createCheckpoint("c1");
      List<HistoryEntry> atCheckpoint = history.entries();

      addLayer("Cloud");
      addLayer("Sun");
      addLayer("Bird");

      assertThat(checkpoints.revertToCheckpoint("c1")).isTrue();

      assertThat(history.entries()).isEqualTo(atCheckpoint);
      assertThat(eventLog.query(EventQuery.ofTypes(LAYER_ADDED))).hasSize(5);
    }

    @Test
    @DisplayName("revert - should append a marker event")
    void testMarker() {
      checkpoints.createCheckpoint("c1");
      addLayer("A");

      checkpoints.revertToCheckpoint("c1");

      Event marker = eventLog.readAll().get(eventLog.size() - 1);
      assertThat(marker.type()).isEqualTo(EventTypeConstants.CHECKPOINT_REVERTED);
      assertThat(marker.payloadText("checkpointId")).isEqualTo("c1");
    }

    @Test
    @DisplayName("revert - without progress should return false")
    void testNoProgress() {
      addLayer("A");
      checkpoints.createCheckpoint("c1");

      assertThat(checkpoints.revertToCheckpoint("c1")).isFalse();
      assertThat(history.undoDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("revert - should restore the redo stack when a redo followed the checkpoint")
    void testRedoAfterCheckpoint() {
      addLayer("A");
      history.undo();
      checkpoints.createCheckpoint("c1");
      List<HistoryEntry> redoAtCheckpoint = history.redoEntries();

      history.redo();
      checkpoints.revertToCheckpoint("c1");

      assertThat(history.undoDepth()).isZero();
      assertThat(history.redoDepth()).isEqualTo(1);
      assertThat(history.redoEntries()).isEqualTo(redoAtCheckpoint);
    }

    @Test
    @DisplayName("revert - repeating a revert should not report discarded progress")
    void testRepeatedRevert() {
      checkpoints.createCheckpoint("c1");
      addLayer("A");

      assertThat(checkpoints.revertToCheckpoint("c1")).isTrue();
      assertThat(checkpoints.revertToCheckpoint("c1")).isFalse();

      addLayer("B");
      assertThat(checkpoints.revertToCheckpoint("c1")).isTrue();
    }

    @Test
    @DisplayName("revert - should not deadlock with a checkpoint created by an undo listener")
    void testRevertDuringUndo() throws Exception {
      addLayer("A");
      addLayer("B");
      checkpoints.createCheckpoint("c1");
      CountDownLatch revertStarted = new CountDownLatch(1);
      AtomicBoolean handled = new AtomicBoolean();
      ExecutorService executor = Executors.newFixedThreadPool(2);
      eventLog.addListener(
          event -> {
            if (event.type().equals(EventTypeConstants.HISTORY_UNDO)
                && handled.compareAndSet(false, true)) {
              executor.submit(
                  () -> {
                    revertStarted.countDown();
                    return checkpoints.revertToCheckpoint("c1");
                  });
              try {
                revertStarted.await(5, TimeUnit.SECONDS);
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              checkpoints.createCheckpoint("during-undo");
            }
          });
      try {
        Future<Boolean> undo = executor.submit(history::undo);

        assertThat(undo.get(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(history.undoDepth()).isEqualTo(2);
        assertThat(checkpoints.getCheckpoint("during-undo")).isEmpty();
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    @DisplayName("revert - should drop checkpoints created after the target")
    void testDropsLaterCheckpoints() {
      checkpoints.createCheckpoint("start");
      addLayer("A");
      checkpoints.createCheckpoint("middle");
      addLayer("B");
      checkpoints.createCheckpoint("end");

      checkpoints.revertToCheckpoint("middle");

      assertThat(checkpoints.listCheckpoints())
          .extracting(Checkpoint::id)
          .containsExactly("start", "middle");
    }

    @Test
    @DisplayName("revert - unknown id should raise CheckpointNotFoundException")
    void testUnknown() {
      assertThatThrownBy(() -> checkpoints.revertToCheckpoint("missing"))
          .isInstanceOf(CheckpointNotFoundException.class)
          .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("revert - should notify listeners")
    void testListener() {
      CheckpointListener listener = mock(CheckpointListener.class);
      checkpoints.addListener(listener);
      Checkpoint c1 = checkpoints.createCheckpoint("c1");
      addLayer("A");

      checkpoints.revertToCheckpoint("c1");

      verify(listener).onReverted(c1, true);
    }
  }

  @Nested
  @DisplayName("Bookkeeping Tests")
  class BookkeepingTests {

    @Test
    @DisplayName("createCheckpoint - should record the log head and replace existing ids")
    void testCreate() {
      addLayer("A");
      checkpoints.createCheckpoint("c1");
      addLayer("B");

      Checkpoint replaced = checkpoints.createCheckpoint("c1");

      assertThat(replaced.sequence()).isEqualTo(eventLog.headSequence());
      assertThat(checkpoints.listCheckpoints()).containsExactly(replaced);
      assertThat(checkpoints.getCheckpoint("c1")).contains(replaced);
    }

    @Test
    @DisplayName("deleteCheckpoint - should remove the checkpoint")
    void testDelete() {
      checkpoints.createCheckpoint("c1");

      assertThat(checkpoints.deleteCheckpoint("c1")).isTrue();
      assertThat(checkpoints.deleteCheckpoint("c1")).isFalse();
      assertThat(checkpoints.getCheckpoint("c1")).isEmpty();
    }
  }
}
