package com.memoryengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.memoryengine.domain.enums.CycleOutcome;
import com.memoryengine.domain.model.BranchSelection;
import com.memoryengine.domain.model.BranchWarning;
import com.memoryengine.domain.model.CycleReport;
import com.memoryengine.domain.model.EvaluationState;
import com.memoryengine.event.IfMemoryEvaluatedEvent;
import com.memoryengine.ifmemory.IfMemoryEngine;
import com.memoryengine.observability.EngineMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EngineMetricsServiceTest {

    private static final UUID MEMORY_ID = UUID.randomUUID();

    @Mock
    private IfMemoryEngine ifMemoryEngine;

    private SimpleMeterRegistry meterRegistry;
    private EngineMetricsService engineMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engineMetricsService = new EngineMetricsService(meterRegistry, ifMemoryEngine);
    }

    private void publish(CycleOutcome outcome, BranchSelection selection) {
        CycleReport report = CycleReport.builder()
                .memoryId(MEMORY_ID)
                .outcome(outcome)
                .selection(selection)
                .durationNanos(TimeUnit.MILLISECONDS.toNanos(4))
                .build();
        engineMetricsService.onIfMemoryEvaluated(new IfMemoryEvaluatedEvent(this, report));
    }

    private static BranchSelection defaultSelection(int warnings) {
        List<BranchWarning> warningList = IntStream.range(0, warnings)
                .mapToObj(i -> BranchWarning.builder().branchOrder(i).message("Unknown alias 'x'").build())
                .toList();
        return BranchSelection.builder()
                .value(0)
                .warnings(warningList)
                .nextState(EvaluationState.initial())
                .build();
    }

    private double cycles(String outcome) {
        return meterRegistry.get("ifmemory.cycles").tag("outcome", outcome).counter().count();
    }

    @Test
    @DisplayName("Cycles are counted by outcome and timed")
    void countsCycles() {
        publish(CycleOutcome.COMMITTED, defaultSelection(0));
        publish(CycleOutcome.COMMITTED, defaultSelection(0));
        publish(CycleOutcome.RESOLUTION_FAILED, null);
        publish(CycleOutcome.COMMIT_FAILED, defaultSelection(0));

        assertThat(cycles("committed")).isEqualTo(2.0);
        assertThat(cycles("resolution_failed")).isEqualTo(1.0);
        assertThat(cycles("commit_failed")).isEqualTo(1.0);
        assertThat(meterRegistry.get("ifmemory.cycle.duration").timer().count()).isEqualTo(4);
    }

    @Test
    @DisplayName("Skipped cycles are not counted")
    void skippedIgnored() {
        engineMetricsService.onIfMemoryEvaluated(new IfMemoryEvaluatedEvent(this, CycleReport.skipped(MEMORY_ID)));

        assertThat(meterRegistry.get("ifmemory.cycle.duration").timer().count()).isZero();
    }

    @Test
    @DisplayName("Branch warnings are counted individually")
    void countsWarnings() {
        publish(CycleOutcome.COMMITTED, defaultSelection(2));

        assertThat(meterRegistry.get("ifmemory.branch.warnings").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Active instance gauge reads the engine")
    void activeInstances() {
        when(ifMemoryEngine.getActiveInstanceCount()).thenReturn(3);

        assertThat(meterRegistry.get("ifmemory.instances.active").gauge().value()).isEqualTo(3.0);
    }
}
