package com.memoryengine.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Dry-run result: {@code result} is set when {@code valid}, {@code error} otherwise. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestConditionResponse {

    private boolean valid;
    private Boolean result;
    private String error;
}
