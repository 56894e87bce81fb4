package com.memoryengine.ifmemory;

import com.memoryengine.domain.enums.CycleOutcome;
import com.memoryengine.domain.enums.EvaluationStatus;
import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.BranchSelection;
import com.memoryengine.domain.model.BranchWarning;
import com.memoryengine.domain.model.CycleReport;
import com.memoryengine.domain.model.EvaluationPreview;
import com.memoryengine.domain.model.EvaluationState;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.InstanceStatus;
import com.memoryengine.event.EventPublisherHelper;
import com.memoryengine.event.IfMemoryChangedEvent;
import com.memoryengine.exception.OutputCommitException;
import com.memoryengine.exception.SourceResolutionException;
import com.memoryengine.mapper.IfMemoryMapper;
import com.memoryengine.repository.jpa.IfMemoryJpaRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs every enabled IF memory on its own fixed-rate timer.
 *
 * <p><b>Cycle:</b> resolve all bindings into a snapshot, let the
 * {@link BranchStateMachine} pick a branch from the previous {@link EvaluationState},
 * store the next state, then commit the value through the {@link OutputCommitter}.
 * A resolution failure skips the cycle and leaves output and state untouched; a commit
 * failure is reported and retried by the next cycle. Neither escapes the timer task.
 *
 * <p><b>Concurrency:</b> each instance owns a lock. Cycles, definition swaps and status
 * reads for one instance take it, so a cycle always sees one complete definition and
 * the hysteresis state has a single writer. Different instances never share a lock and
 * run in parallel on the shared scheduler.
 *
 * <p><b>Lifecycle:</b> definitions are loaded at startup and then follow
 * {@link IfMemoryChangedEvent}s from the configuration services. A change to branches
 * or bindings resets the hysteresis state; a change of interval reschedules the timer;
 * disabling or deleting cancels the timer and discards all runtime state.
 */
@Service
public class IfMemoryEngine {

    private static final Logger log = LoggerFactory.getLogger(IfMemoryEngine.class);

    private final IfMemoryEngineConfig ifMemoryEngineConfig;
    private final IfMemoryJpaRepository ifMemoryJpaRepository;
    private final VariableBindingTable variableBindingTable;
    private final BranchStateMachine branchStateMachine;
    private final OutputCommitter outputCommitter;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler taskScheduler;

    private final IfMemoryMapper ifMemoryMapper = Mappers.getMapper(IfMemoryMapper.class);

    /** Installed (enabled) instances keyed by IF memory id. */
    private final Map<UUID, InstanceRuntime> instances = new ConcurrentHashMap<>();

    public IfMemoryEngine(
            IfMemoryEngineConfig ifMemoryEngineConfig,
            IfMemoryJpaRepository ifMemoryJpaRepository,
            VariableBindingTable variableBindingTable,
            BranchStateMachine branchStateMachine,
            OutputCommitter outputCommitter,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("ifMemoryTaskScheduler") TaskScheduler taskScheduler) {
        this.ifMemoryEngineConfig = ifMemoryEngineConfig;
        this.ifMemoryJpaRepository = ifMemoryJpaRepository;
        this.variableBindingTable = variableBindingTable;
        this.branchStateMachine = branchStateMachine;
        this.outputCommitter = outputCommitter;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskScheduler = taskScheduler;
    }

    @PostConstruct
    public void loadAll() {
        if (!ifMemoryEngineConfig.isEnabled()) {
            log.info("IF-memory engine is disabled");
            return;
        }

        List<IfMemory> enabled = ifMemoryMapper.toDomainList(ifMemoryJpaRepository.findByDisabledFalse());
        enabled.forEach(this::install);
        log.info("Loaded {} enabled IF memories", enabled.size());
    }

    @PreDestroy
    public void shutdown() {
        instances.keySet().forEach(this::uninstall);
    }

    @EventListener
    public void onIfMemoryChanged(IfMemoryChangedEvent event) {
        if (!ifMemoryEngineConfig.isEnabled()) {
            return;
        }

        switch (event.getChangeType()) {
            case CREATED, UPDATED -> {
                IfMemory ifMemory = event.getIfMemory();
                if (ifMemory.isDisabled()) {
                    uninstall(ifMemory.getId());
                } else {
                    install(ifMemory);
                }
            }
            case DELETED -> uninstall(event.getMemoryId());
        }
    }

    /**
     * Installs or replaces the definition of an enabled IF memory. The swap happens
     * under the instance lock, between cycles. A runtime removed by a concurrent
     * {@link #uninstall} while this call waited for its lock is left alone and a fresh
     * one is installed instead.
     */
    void install(IfMemory ifMemory) {
        IfMemory definition = ifMemory.snapshot();
        while (!tryInstall(definition)) {
            log.debug("IF memory {} was uninstalled concurrently, installing again", definition.getId());
        }
    }

    private boolean tryInstall(IfMemory definition) {
        InstanceRuntime runtime = instances.computeIfAbsent(definition.getId(), InstanceRuntime::new);

        runtime.lock.lock();
        try {
            if (instances.get(definition.getId()) != runtime) {
                return false;
            }

            IfMemory previous = runtime.definition;
            if (previous != null && previous.isStructurallyDifferentFrom(definition)) {
                log.info("IF memory {} branches or bindings changed, resetting evaluation state", definition.getId());
                runtime.state = EvaluationState.initial();
            }
            boolean reschedule = previous == null
                    || runtime.future == null
                    || previous.getInterval() != definition.getInterval();
            runtime.definition = definition;

            if (reschedule) {
                schedule(runtime);
            }
            return true;
        } finally {
            runtime.lock.unlock();
        }
    }

    /** Cancels the timer of an IF memory and forgets its runtime state. */
    void uninstall(UUID memoryId) {
        InstanceRuntime runtime = instances.remove(memoryId);
        if (runtime == null) {
            return;
        }
        runtime.lock.lock();
        try {
            if (runtime.future != null) {
                runtime.future.cancel(false);
                runtime.future = null;
            }
        } finally {
            runtime.lock.unlock();
        }
        log.info("IF memory {} unscheduled", memoryId);
    }

    private void schedule(InstanceRuntime runtime) {
        if (runtime.future != null) {
            runtime.future.cancel(false);
        }
        Duration period = Duration.ofSeconds(Math.max(1, runtime.definition.getInterval()));
        UUID memoryId = runtime.memoryId;
        runtime.future = taskScheduler.scheduleAtFixedRate(
                () -> runScheduledCycle(memoryId), Instant.now().plus(period), period);
        log.info("IF memory {} ({}) scheduled every {}s", memoryId, runtime.definition.getName(), period.toSeconds());
    }

    private void runScheduledCycle(UUID memoryId) {
        try {
            evaluateNow(memoryId);
        } catch (RuntimeException e) {
            // An exception escaping here would cancel the periodic task.
            log.error("Unexpected error evaluating IF memory {}", memoryId, e);
        }
    }

    /**
     * Runs one cycle of an installed IF memory on the calling thread.
     * Returns a SKIPPED report if the memory is not installed (disabled, deleted or
     * engine off).
     */
    public CycleReport evaluateNow(UUID memoryId) {
        InstanceRuntime runtime = instances.get(memoryId);
        if (runtime == null) {
            return CycleReport.skipped(memoryId);
        }

        CycleReport report;
        runtime.lock.lock();
        try {
            if (instances.get(memoryId) != runtime || runtime.definition == null) {
                return CycleReport.skipped(memoryId);
            }
            report = runCycle(runtime);
        } finally {
            runtime.lock.unlock();
        }
        eventPublisherHelper.publishIfMemoryEvaluated(this, report);
        return report;
    }

    private CycleReport runCycle(InstanceRuntime runtime) {
        IfMemory definition = runtime.definition;
        long startNanos = System.nanoTime();

        BindingSnapshot snapshot;
        try {
            snapshot = variableBindingTable.snapshot(definition.getVariableBindings());
        } catch (SourceResolutionException e) {
            log.warn("IF memory {} skipped cycle, {} ({})", definition.getId(), e.getMessage(), e.getFailure());
            runtime.recordResolutionFailure(e.getMessage());
            return CycleReport.builder()
                    .memoryId(definition.getId())
                    .outcome(CycleOutcome.RESOLUTION_FAILED)
                    .error(e.getMessage())
                    .durationNanos(System.nanoTime() - startNanos)
                    .build();
        }

        BranchSelection selection = branchStateMachine.evaluate(
                definition.getBranches(),
                definition.getDefaultValue(),
                definition.getInterval(),
                snapshot,
                runtime.state);
        runtime.state = selection.getNextState();
        for (BranchWarning warning : selection.getWarnings()) {
            log.warn(
                    "IF memory {} branch {} treated as false: {}",
                    definition.getId(),
                    warning.getBranchOrder(),
                    warning.getMessage());
        }

        try {
            double written = outputCommitter.commit(
                    definition.getOutputDestination(), definition.getOutputType(), selection.getValue());
            runtime.recordCommitted(selection, written);
            log.debug(
                    "IF memory {} wrote {} to {} (branch {}, held={})",
                    definition.getId(),
                    written,
                    definition.getOutputDestination(),
                    selection.isDefault() ? "default" : selection.getSelectedOrder(),
                    selection.isHeld());
            return report(definition, CycleOutcome.COMMITTED, selection, null, startNanos);
        } catch (OutputCommitException e) {
            log.warn("IF memory {} commit failed: {}", definition.getId(), e.getMessage());
            runtime.recordCommitFailure(selection, e.getMessage());
            return report(definition, CycleOutcome.COMMIT_FAILED, selection, e.getMessage(), startNanos);
        }
    }

    private static CycleReport report(
            IfMemory definition, CycleOutcome outcome, BranchSelection selection, String error, long startNanos) {
        return CycleReport.builder()
                .memoryId(definition.getId())
                .outcome(outcome)
                .selection(selection)
                .error(error)
                .durationNanos(System.nanoTime() - startNanos)
                .build();
    }

    /**
     * Dry run of {@code ifMemory} against live data, starting from the instance's
     * current hysteresis state (or the initial state if it is not installed).
     * Commits nothing and stores nothing.
     */
    public EvaluationPreview preview(IfMemory ifMemory) {
        IfMemory definition = ifMemory.snapshot();
        EvaluationState state = currentState(definition);

        BindingSnapshot snapshot;
        try {
            snapshot = variableBindingTable.snapshot(definition.getVariableBindings());
        } catch (SourceResolutionException e) {
            return EvaluationPreview.builder()
                    .memoryId(definition.getId())
                    .resolutionError(e.getMessage())
                    .build();
        }

        BranchSelection selection = branchStateMachine.evaluate(
                definition.getBranches(), definition.getDefaultValue(), definition.getInterval(), snapshot, state);
        return EvaluationPreview.builder()
                .memoryId(definition.getId())
                .bindings(snapshot)
                .selection(selection)
                .build();
    }

    private EvaluationState currentState(IfMemory definition) {
        InstanceRuntime runtime = instances.get(definition.getId());
        if (runtime == null) {
            return EvaluationState.initial();
        }
        runtime.lock.lock();
        try {
            // State built for other branches would be meaningless here
            if (runtime.definition == null || runtime.definition.isStructurallyDifferentFrom(definition)) {
                return EvaluationState.initial();
            }
            return runtime.state;
        } finally {
            runtime.lock.unlock();
        }
    }

    /** Runtime status of {@code ifMemory}; DISABLED when it is disabled or the engine is off. */
    public InstanceStatus getStatus(IfMemory ifMemory) {
        InstanceRuntime runtime = instances.get(ifMemory.getId());
        boolean disabled = !ifMemoryEngineConfig.isEnabled() || ifMemory.isDisabled();
        if (disabled || runtime == null) {
            return inactiveStatus(ifMemory, disabled);
        }

        runtime.lock.lock();
        try {
            if (runtime.definition == null) {
                return inactiveStatus(ifMemory, false);
            }
            return runtime.toStatus(ifMemoryEngineConfig.getStaleAfterFailures());
        } finally {
            runtime.lock.unlock();
        }
    }

    private static InstanceStatus inactiveStatus(IfMemory ifMemory, boolean disabled) {
        return InstanceStatus.builder()
                .memoryId(ifMemory.getId())
                .name(ifMemory.getName())
                .status(disabled ? EvaluationStatus.DISABLED : EvaluationStatus.IDLE)
                .warnings(List.of())
                .build();
    }

    public int getActiveInstanceCount() {
        return instances.size();
    }

    boolean isInstalled(UUID memoryId) {
        return instances.containsKey(memoryId);
    }

    /**
     * Per-instance runtime: current definition, hysteresis state, timer handle and the
     * bookkeeping behind {@link InstanceStatus}. All fields are guarded by {@code lock}.
     */
    private static final class InstanceRuntime {

        private final UUID memoryId;
        private final ReentrantLock lock = new ReentrantLock();

        private IfMemory definition;
        private EvaluationState state = EvaluationState.initial();
        private ScheduledFuture<?> future;

        private Double lastOutput;
        private CycleOutcome lastOutcome;
        private LocalDateTime lastEvaluatedAt;
        private int consecutiveResolutionFailures;
        private int consecutiveCommitFailures;
        private String lastError;
        private List<BranchWarning> lastWarnings = List.of();

        private InstanceRuntime(UUID memoryId) {
            this.memoryId = memoryId;
        }

        void recordResolutionFailure(String error) {
            lastOutcome = CycleOutcome.RESOLUTION_FAILED;
            lastEvaluatedAt = LocalDateTime.now();
            consecutiveResolutionFailures++;
            lastError = error;
            lastWarnings = List.of();
        }

        void recordCommitted(BranchSelection selection, double written) {
            lastOutcome = CycleOutcome.COMMITTED;
            lastEvaluatedAt = LocalDateTime.now();
            lastOutput = written;
            consecutiveResolutionFailures = 0;
            consecutiveCommitFailures = 0;
            lastError = null;
            lastWarnings = selection.getWarnings();
        }

        void recordCommitFailure(BranchSelection selection, String error) {
            lastOutcome = CycleOutcome.COMMIT_FAILED;
            lastEvaluatedAt = LocalDateTime.now();
            consecutiveResolutionFailures = 0;
            consecutiveCommitFailures++;
            lastError = error;
            lastWarnings = selection.getWarnings();
        }

        InstanceStatus toStatus(int staleAfterFailures) {
            return InstanceStatus.builder()
                    .memoryId(memoryId)
                    .name(definition.getName())
                    .status(evaluationStatus(staleAfterFailures))
                    .activeBranchOrder(state.getActiveBranchOrder())
                    .lastOutput(lastOutput)
                    .lastOutcome(lastOutcome)
                    .lastEvaluatedAt(lastEvaluatedAt)
                    .consecutiveResolutionFailures(consecutiveResolutionFailures)
                    .consecutiveCommitFailures(consecutiveCommitFailures)
                    .lastError(lastError)
                    .warnings(lastWarnings)
                    .build();
        }

        private EvaluationStatus evaluationStatus(int staleAfterFailures) {
            if (lastOutcome == null) {
                return EvaluationStatus.IDLE;
            }
            if (consecutiveResolutionFailures >= staleAfterFailures) {
                return EvaluationStatus.STALE;
            }
            if (lastOutcome != CycleOutcome.COMMITTED || !lastWarnings.isEmpty()) {
                return EvaluationStatus.DEGRADED;
            }
            return EvaluationStatus.HEALTHY;
        }
    }
}
