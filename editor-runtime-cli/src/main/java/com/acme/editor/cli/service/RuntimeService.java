package com.acme.editor.cli.service;

import com.acme.editor.runtime.bootstrap.RuntimeBootstrap;
import com.acme.editor.runtime.config.RuntimeConfig;
import com.acme.editor.runtime.container.ServiceInfo;
import com.acme.editor.runtime.container.ServiceRegistry;
import com.acme.editor.runtime.core.ServiceTokens;
import com.acme.editor.runtime.event.CompactedRangeException;
import com.acme.editor.runtime.event.EventDraft;
import com.acme.editor.runtime.event.EventLog;
import com.acme.editor.runtime.event.RestoredState;
import com.acme.editor.runtime.event.Snapshot;
import com.acme.editor.runtime.event.SnapshotStore;
import com.acme.editor.runtime.history.CheckpointRegistry;
import com.acme.editor.runtime.history.HistoryManager;
import com.acme.editor.runtime.history.InverseEventRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Boots a fresh in-memory runtime for one CLI invocation and drives it.
 */
@Slf4j
public class RuntimeService implements AutoCloseable {
    static final String LAYER_ADDED = "layer.added";
    static final String LAYER_REMOVED = "layer.removed";
    private static final List<String> SIMULATED_TYPES = List.of("stroke", "layer.moved", "filter.applied");

    private final ServiceRegistry registry;

    public RuntimeService(RuntimeConfig config) {
        this.registry = new RuntimeBootstrap(config).boot();
        log.info("Runtime service started");
    }

    public List<ServiceInfo> listServices() {
        return registry.listDescriptors();
    }

    /**
     * Appends {@code events} synthetic events and restores the state at {@code target} (the head
     * when {@code null}).
     */
    public LogSimulation simulateLog(int events, Long target) {
        if (events < 0) {
            throw new IllegalArgumentException("events must not be negative: " + events);
        }
        EventLog eventLog = registry.resolveSync(ServiceTokens.EVENT_LOG);
        SnapshotStore<Map<String, Long>> snapshots = registry.resolveSync(ServiceTokens.SNAPSHOT_STORE);
        for (int i = 0; i < events; i++) {
            eventLog.append(SIMULATED_TYPES.get(i % SIMULATED_TYPES.size()), Map.of("index", i));
        }
        long head = eventLog.headSequence();
        long targetSequence = target != null ? target : head;
        RestoredState<Map<String, Long>> restored = snapshots.restore(eventLog, targetSequence);

        Boolean matches;
        try {
            matches = snapshots.replayFromStart(eventLog, targetSequence).state().equals(restored.state());
        } catch (CompactedRangeException e) {
            log.debug("Full replay to {} not possible: {}", targetSequence, e.getMessage());
            matches = null;
        }
        List<Long> snapshotSequences = snapshots.list().stream().map(Snapshot::sequence).toList();
        return new LogSimulation(
                events,
                head,
                eventLog.size(),
                eventLog.firstRetainedSequence(),
                snapshotSequences,
                targetSequence,
                restored.snapshotSequence(),
                restored.eventsReplayed(),
                matches);
    }

    /**
     * Records {@code actions} layer additions, checkpoints, exercises undo and redo, then reverts.
     */
    public List<HistoryStep> historyDemo(int actions) {
        if (actions <= 0) {
            throw new IllegalArgumentException("actions must be positive: " + actions);
        }
        InverseEventRegistry inverses = registry.resolveSync(ServiceTokens.INVERSE_EVENTS);
        if (!inverses.supports(LAYER_ADDED)) {
            inverses.registerPair(LAYER_ADDED, LAYER_REMOVED);
        }
        HistoryManager history = registry.resolveSync(ServiceTokens.HISTORY_MANAGER);
        CheckpointRegistry checkpoints = registry.resolveSync(ServiceTokens.CHECKPOINT_REGISTRY);
        EventLog eventLog = registry.resolveSync(ServiceTokens.EVENT_LOG);

        List<HistoryStep> steps = new ArrayList<>();
        for (int i = 1; i <= actions; i++) {
            addLayer(history, "Layer " + i);
        }
        steps.add(step("record " + actions + " actions", history, eventLog));

        checkpoints.createCheckpoint("demo");
        steps.add(step("checkpoint 'demo'", history, eventLog));

        history.undo();
        steps.add(step("undo", history, eventLog));

        history.redo();
        steps.add(step("redo", history, eventLog));

        addLayer(history, "Layer " + (actions + 1));
        addLayer(history, "Layer " + (actions + 2));
        steps.add(step("record 2 more actions", history, eventLog));

        boolean discarded = checkpoints.revertToCheckpoint("demo");
        steps.add(step("revert to 'demo'" + (discarded ? "" : " (nothing to discard)"), history, eventLog));
        return steps;
    }

    private static void addLayer(HistoryManager history, String name) {
        history.recordAction("Add " + name, List.of(EventDraft.of(LAYER_ADDED, Map.of("name", name))));
    }

    private static HistoryStep step(String action, HistoryManager history, EventLog eventLog) {
        return new HistoryStep(action, history.undoDepth(), history.redoDepth(), eventLog.headSequence());
    }

    @Override
    public void close() {
        registry.close();
        log.info("Runtime service stopped");
    }
}
