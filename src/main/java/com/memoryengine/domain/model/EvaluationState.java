package com.memoryengine.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Transient per-instance state carried between evaluation cycles.
 *
 * <p>{@code activeBranchOrder} is the branch latched as selected by the previous cycle
 * (null when the default value was emitted). {@code falseRunLength} counts consecutive
 * cycles in which that branch's own condition was not true while it was being held by
 * hysteresis. Instances are immutable; the state machine returns a new one per cycle.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EvaluationState {

    private static final EvaluationState INITIAL = new EvaluationState(null, 0);

    private final Integer activeBranchOrder;
    private final int falseRunLength;

    private EvaluationState(Integer activeBranchOrder, int falseRunLength) {
        this.activeBranchOrder = activeBranchOrder;
        this.falseRunLength = falseRunLength;
    }

    public static EvaluationState initial() {
        return INITIAL;
    }

    public static EvaluationState active(int branchOrder) {
        return new EvaluationState(branchOrder, 0);
    }

    public static EvaluationState holding(int branchOrder, int falseRunLength) {
        return new EvaluationState(branchOrder, falseRunLength);
    }

    public boolean hasActiveBranch() {
        return activeBranchOrder != null;
    }
}
