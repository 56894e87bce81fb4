package com.memoryengine.api.dto.request;

import com.memoryengine.domain.enums.OutputType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for creating or replacing an IF memory.
 *
 * <p>Only shape is checked here; the semantic rules (branch cap, aliases, source
 * existence, destination compatibility, interval) are applied by IfMemoryValidator.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IfMemoryRequest {

    @NotBlank
    @Size(max = 200)
    private String name;

    private String description;

    @Valid
    @Builder.Default
    private List<BranchRequest> branches = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<VariableBindingRequest> variableBindings = new ArrayList<>();

    private double defaultValue;

    /** Encoded destination, {@code P:<guid>} or {@code GV:<name>}. */
    @NotBlank
    private String outputDestination;

    @NotNull
    private OutputType outputType;

    @NotNull
    private Integer interval;

    private boolean disabled;
}
