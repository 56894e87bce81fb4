package com.memoryengine.observability;

import com.memoryengine.domain.enums.CycleOutcome;
import com.memoryengine.domain.model.CycleReport;
import com.memoryengine.event.IfMemoryEvaluatedEvent;
import com.memoryengine.ifmemory.IfMemoryEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the IF-memory engine:
 * <ul>
 *   <li><b>ifmemory.cycles</b> (counter, tag {@code outcome}): completed cycles by outcome</li>
 *   <li><b>ifmemory.branch.warnings</b> (counter): branch conditions that failed to evaluate</li>
 *   <li><b>ifmemory.cycle.duration</b> (timer): resolve + evaluate + commit time</li>
 *   <li><b>ifmemory.instances.active</b> (gauge): instances with a running timer</li>
 * </ul>
 */
@Service
public class EngineMetricsService {

    private final Map<CycleOutcome, Counter> cycleCounters = new EnumMap<>(CycleOutcome.class);
    private final Counter branchWarningCounter;
    private final Timer cycleDurationTimer;

    public EngineMetricsService(MeterRegistry meterRegistry, IfMemoryEngine ifMemoryEngine) {
        for (CycleOutcome outcome : CycleOutcome.values()) {
            if (outcome == CycleOutcome.SKIPPED) {
                continue;
            }
            cycleCounters.put(
                    outcome,
                    Counter.builder("ifmemory.cycles")
                            .description("IF memory evaluation cycles by outcome")
                            .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                            .register(meterRegistry));
        }

        this.branchWarningCounter = Counter.builder("ifmemory.branch.warnings")
                .description("Branch conditions treated as false because they could not be evaluated")
                .register(meterRegistry);

        this.cycleDurationTimer = Timer.builder("ifmemory.cycle.duration")
                .description("Duration of one IF memory cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        meterRegistry.gauge("ifmemory.instances.active", ifMemoryEngine, IfMemoryEngine::getActiveInstanceCount);
    }

    @EventListener
    @Order(20)
    public void onIfMemoryEvaluated(IfMemoryEvaluatedEvent event) {
        CycleReport report = event.getCycleReport();
        Counter counter = cycleCounters.get(report.getOutcome());
        if (counter == null) {
            return;
        }
        counter.increment();
        cycleDurationTimer.record(report.getDurationNanos(), TimeUnit.NANOSECONDS);
        if (report.getSelection() != null && !report.getSelection().getWarnings().isEmpty()) {
            branchWarningCounter.increment(report.getSelection().getWarnings().size());
        }
    }
}
