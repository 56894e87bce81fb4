package com.memoryengine.api.dto.response;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of a preview run: what the next cycle would select and write, computed from
 * live data without committing or advancing hysteresis state.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationPreviewResponse {

    private UUID memoryId;

    /** False when bindings could not be resolved; see {@code resolutionError}. */
    private boolean evaluated;

    private String resolutionError;
    private Map<String, Object> bindings;
    private Integer selectedOrder;
    private String selectedBranchId;
    private String selectedBranchName;
    private Double value;
    private boolean held;
    private boolean usedDefault;
    private List<BranchWarningResponse> warnings;
}
