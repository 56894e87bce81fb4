package com.memoryengine.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Decision produced by the branch state machine for one cycle.
 *
 * <p>{@code selectedOrder} is null when no branch matched and {@code value} is the
 * default. {@code held} is true when the selected branch's own condition was not true
 * but hysteresis kept it selected. {@code nextState} is what the engine stores for the
 * following cycle; dry runs discard it.
 */
@Getter
@AllArgsConstructor
@Builder
@ToString
public class BranchSelection {

    private final Integer selectedOrder;
    private final String selectedBranchId;
    private final String selectedBranchName;
    private final double value;
    private final boolean held;
    private final List<BranchWarning> warnings;
    private final EvaluationState nextState;

    public boolean isDefault() {
        return selectedOrder == null;
    }
}
