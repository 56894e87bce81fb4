package com.memoryengine.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** New live value: a JSON boolean for BOOLEAN variables, a number for FLOAT ones. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GlobalVariableValueRequest {

    @NotNull
    private Object value;
}
