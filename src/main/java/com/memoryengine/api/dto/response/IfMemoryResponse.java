package com.memoryengine.api.dto.response;

import com.memoryengine.domain.enums.OutputType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for an IF memory.
 * Branches are listed in evaluation order; sources and destination are in encoded form.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IfMemoryResponse {

    private UUID id;
    private String name;
    private String description;
    private List<BranchResponse> branches;
    private List<VariableBindingResponse> variableBindings;
    private double defaultValue;
    private String outputDestination;
    private OutputType outputType;
    private int interval;
    private boolean disabled;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
