package com.memoryengine.exception;

import com.memoryengine.domain.model.SourceReference;
import java.util.Map;
import lombok.Getter;

/**
 * The selected value could not be written to the IF memory's destination
 * (missing destination, wrong underlying type, store timeout). Retried next cycle.
 */
@Getter
public class OutputCommitException extends BaseException {

    private final SourceReference destination;

    public OutputCommitException(SourceReference destination, String message) {
        super(ErrorCode.COMMIT_FAILED, message, Map.of("destination", String.valueOf(destination)));
        this.destination = destination;
    }

    public OutputCommitException(SourceReference destination, String message, Throwable cause) {
        super(ErrorCode.COMMIT_FAILED, message, Map.of("destination", String.valueOf(destination)), cause);
        this.destination = destination;
    }
}
