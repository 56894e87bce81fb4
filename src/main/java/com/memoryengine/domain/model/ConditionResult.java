package com.memoryengine.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of evaluating one condition: either a boolean result or an error message
 * (bad syntax, unknown alias, type mismatch). Never both.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ConditionResult {

    private final boolean valid;
    private final Boolean result;
    private final String error;

    private ConditionResult(boolean valid, Boolean result, String error) {
        this.valid = valid;
        this.result = result;
        this.error = error;
    }

    public static ConditionResult of(boolean result) {
        return new ConditionResult(true, result, null);
    }

    public static ConditionResult error(String error) {
        return new ConditionResult(false, null, error);
    }

    /** True only for a valid evaluation that yielded true. Errors count as false. */
    public boolean isTrue() {
        return valid && Boolean.TRUE.equals(result);
    }
}
