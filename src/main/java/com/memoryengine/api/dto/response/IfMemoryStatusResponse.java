package com.memoryengine.api.dto.response;

import com.memoryengine.domain.enums.CycleOutcome;
import com.memoryengine.domain.enums.EvaluationStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IfMemoryStatusResponse {

    private UUID memoryId;
    private String name;
    private EvaluationStatus status;
    private Integer activeBranchOrder;
    private Double lastOutput;
    private CycleOutcome lastOutcome;
    private LocalDateTime lastEvaluatedAt;
    private int consecutiveResolutionFailures;
    private int consecutiveCommitFailures;
    private String lastError;
    private List<BranchWarningResponse> warnings;
}
