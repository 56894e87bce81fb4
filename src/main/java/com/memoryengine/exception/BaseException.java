package com.memoryengine.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the errors the REST layer renders as an error envelope.
 *
 * <p>{@link GlobalExceptionHandler} turns the {@link ErrorCode} into the HTTP status and
 * {@code error.code}, and copies {@code details} to {@code error.details}. Validation
 * failures key their details by field path (for example {@code branches[2].condition}),
 * so every violation of one request is reported at once. Details keep insertion order.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
