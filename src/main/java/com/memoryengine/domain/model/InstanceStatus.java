package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.CycleOutcome;
import com.memoryengine.domain.enums.EvaluationStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of an IF memory's runtime health, as reported by the engine. */
@Getter
@AllArgsConstructor
@Builder
public class InstanceStatus {

    private final UUID memoryId;
    private final String name;
    private final EvaluationStatus status;
    private final Integer activeBranchOrder;
    private final Double lastOutput;
    private final CycleOutcome lastOutcome;
    private final LocalDateTime lastEvaluatedAt;
    private final int consecutiveResolutionFailures;
    private final int consecutiveCommitFailures;
    private final String lastError;
    private final List<BranchWarning> warnings;
}
