package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.GlobalVariableType;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Definition of a global variable: a named process-wide scalar not tied to a point.
 *
 * <p>The definition lives in the configuration store; the current value lives in the
 * live store as a {@link GlobalVariableValue} keyed by name.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GlobalVariable {

    private UUID id;
    private String name;
    private GlobalVariableType variableType;
    private String description;
    private boolean disabled;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
