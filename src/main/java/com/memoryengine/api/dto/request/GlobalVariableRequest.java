package com.memoryengine.api.dto.request;

import com.memoryengine.domain.enums.GlobalVariableType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
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
public class GlobalVariableRequest {

    @NotBlank
    @Size(max = 100)
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "may contain only letters, digits, '_' and '-'")
    private String name;

    @NotNull
    private GlobalVariableType variableType;

    private String description;

    private boolean disabled;
}
