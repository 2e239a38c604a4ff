package com.acme.editor.cli.service;

import com.acme.editor.runtime.config.RuntimeConfig;
import com.acme.editor.runtime.container.ServiceInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuntimeServiceTest {

    private RuntimeService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private RuntimeService start(int maxEvents, int snapshotInterval) {
        RuntimeConfig config = new RuntimeConfig();
        config.getEventLog().setMaxEvents(maxEvents);
        config.getEventLog().setSnapshotInterval(snapshotInterval);
        service = new RuntimeService(config);
        return service;
    }

    @Test
    void testListServices_includesCoreServices() {
        List<ServiceInfo> services = start(5000, 1000).listServices();

        assertThat(services).extracting(ServiceInfo::token)
                .contains("eventLog", "eventBus", "historyManager", "checkpointRegistry");
    }

    @Test
    void testSimulateLog_restoresAtHeadByDefault() {
        LogSimulation result = start(5000, 100).simulateLog(250, null);

        assertThat(result.headSequence()).isEqualTo(250);
        assertThat(result.targetSequence()).isEqualTo(250);
        assertThat(result.snapshotSequences()).containsExactly(100L, 200L);
        assertThat(result.snapshotUsed()).isEqualTo(200);
        assertThat(result.eventsReplayed()).isEqualTo(50);
        assertThat(result.matchesFullReplay()).isTrue();
    }

    @Test
    void testSimulateLog_skipsFullReplayAfterCompaction() {
        LogSimulation result = start(20, 10).simulateLog(50, 45L);

        assertThat(result.retainedEvents()).isEqualTo(20);
        assertThat(result.firstRetainedSequence()).isEqualTo(31);
        assertThat(result.snapshotUsed()).isEqualTo(40);
        assertThat(result.matchesFullReplay()).isNull();
    }

    @Test
    void testSimulateLog_rejectsNegativeCount() {
        RuntimeService runtime = start(5000, 1000);

        assertThatThrownBy(() -> runtime.simulateLog(-1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHistoryDemo_endsAtCheckpointDepth() {
        List<HistoryStep> steps = start(5000, 1000).historyDemo(3);

        assertThat(steps).hasSize(6);
        assertThat(steps.get(0).undoDepth()).isEqualTo(3);
        assertThat(steps.get(2).undoDepth()).isEqualTo(2);
        assertThat(steps.get(2).redoDepth()).isEqualTo(1);
        assertThat(steps.get(3).undoDepth()).isEqualTo(3);
        assertThat(steps.get(3).redoDepth()).isZero();
        assertThat(steps.get(4).undoDepth()).isEqualTo(5);
        assertThat(steps.get(5).undoDepth()).isEqualTo(3);
        assertThat(steps.get(5).action()).isEqualTo("revert to 'demo'");
    }
}
