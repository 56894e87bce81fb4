package com.memoryengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    COMMIT_FAILED("COMMIT_FAILED", 502),
    SOURCE_UNAVAILABLE("SOURCE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
