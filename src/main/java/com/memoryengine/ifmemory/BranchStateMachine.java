package com.memoryengine.ifmemory;

import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.BranchSelection;
import com.memoryengine.domain.model.BranchWarning;
import com.memoryengine.domain.model.ConditionResult;
import com.memoryengine.domain.model.EvaluationState;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Selects one branch (or the default) per cycle, top-down with time-based hysteresis.
 *
 * <p>Walk: branches are visited in ascending order. A branch ahead of the active one
 * that evaluates true preempts it. When the walk reaches the active branch {@code k}
 * and its condition is not true, {@code k} stays selected (and nothing after it is
 * considered) until it has been non-true for {@code ceil(hysteresis / interval)}
 * consecutive cycles; after that it is released and the walk continues. A branch
 * whose condition cannot be evaluated counts as false and yields a {@link BranchWarning}.
 *
 * <p>Stateless: the previous {@link EvaluationState} comes in, the next one goes out
 * inside the {@link BranchSelection}. Callers decide whether to keep it.
 */
@Component
public class BranchStateMachine {

    /** Absorbs floating point noise in hysteresis / interval before rounding up. */
    private static final double CYCLE_EPSILON = 1e-9;

    private final ConditionEvaluator conditionEvaluator;

    public BranchStateMachine(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * @param branches branches sorted by ascending order
     * @param defaultValue value emitted when no branch is selected
     * @param interval evaluation period, same unit as hysteresis, at least 1
     */
    public BranchSelection evaluate(
            List<Branch> branches,
            double defaultValue,
            int interval,
            BindingSnapshot snapshot,
            EvaluationState previous) {
        List<BranchWarning> warnings = new ArrayList<>();
        Integer activeOrder = previous != null ? previous.getActiveBranchOrder() : null;
        int falseRunLength = previous != null ? previous.getFalseRunLength() : 0;

        for (Branch branch : branches) {
            boolean isTrue = evaluateBranch(branch, snapshot, warnings);

            if (isTrue) {
                return select(branch, false, warnings, EvaluationState.active(branch.getOrder()));
            }

            if (activeOrder != null && branch.getOrder() == activeOrder) {
                int nextRun = falseRunLength + 1;
                if (nextRun < releaseCycles(branch.getHysteresis(), interval)) {
                    return select(branch, true, warnings, EvaluationState.holding(branch.getOrder(), nextRun));
                }
            }
        }

        return BranchSelection.builder()
                .value(defaultValue)
                .held(false)
                .warnings(List.copyOf(warnings))
                .nextState(EvaluationState.initial())
                .build();
    }

    /**
     * Number of consecutive non-true cycles after which an active branch is released.
     * Zero hysteresis releases on the first one.
     */
    public static int releaseCycles(double hysteresis, int interval) {
        if (hysteresis <= 0) {
            return 1;
        }
        return Math.max(1, (int) Math.ceil(hysteresis / Math.max(1, interval) - CYCLE_EPSILON));
    }

    private boolean evaluateBranch(Branch branch, BindingSnapshot snapshot, List<BranchWarning> warnings) {
        ConditionResult result = conditionEvaluator.evaluate(branch.getCondition(), snapshot);
        if (!result.isValid()) {
            warnings.add(BranchWarning.builder()
                    .branchOrder(branch.getOrder())
                    .branchId(branch.getId())
                    .branchName(branch.getName())
                    .message(result.getError())
                    .build());
        }
        return result.isTrue();
    }

    private static BranchSelection select(
            Branch branch, boolean held, List<BranchWarning> warnings, EvaluationState nextState) {
        return BranchSelection.builder()
                .selectedOrder(branch.getOrder())
                .selectedBranchId(branch.getId())
                .selectedBranchName(branch.getName())
                .value(branch.getOutputValue())
                .held(held)
                .warnings(List.copyOf(warnings))
                .nextState(nextState)
                .build();
    }
}
