package com.memoryengine.api.dto.response;

import com.memoryengine.domain.enums.GlobalVariableType;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for a global variable. {@code currentValue} is the live value
 * from Redis, null for disabled variables.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GlobalVariableResponse {

    private UUID id;
    private String name;
    private GlobalVariableType variableType;
    private String description;
    private boolean disabled;
    private String currentValue;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
