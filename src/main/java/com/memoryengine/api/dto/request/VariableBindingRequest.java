package com.memoryengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
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
public class VariableBindingRequest {

    @NotBlank
    private String alias;

    /** Encoded source; an unprefixed value is taken as a point GUID. */
    @NotBlank
    private String source;
}
