package com.memoryengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Dry-run evaluation of one condition. {@code values} maps alias to a JSON boolean
 * or number.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestConditionRequest {

    @NotBlank
    private String condition;

    @Builder.Default
    private Map<String, Object> values = new LinkedHashMap<>();
}
