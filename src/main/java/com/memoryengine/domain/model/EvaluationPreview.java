package com.memoryengine.domain.model;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of a dry-run cycle. Either {@code resolutionError} is set (bindings could not
 * be resolved, nothing was evaluated) or {@code bindings} and {@code selection} are.
 */
@Getter
@AllArgsConstructor
@Builder
public class EvaluationPreview {

    private final UUID memoryId;
    private final BindingSnapshot bindings;
    private final BranchSelection selection;
    private final String resolutionError;
}
