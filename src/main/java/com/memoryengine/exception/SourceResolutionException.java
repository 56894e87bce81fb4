package com.memoryengine.exception;

import com.memoryengine.domain.enums.ResolutionFailure;
import com.memoryengine.domain.model.SourceReference;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A source reference could not be resolved to a live value.
 *
 * <p>Recoverable and per-cycle: the engine skips the output update for the affected
 * IF memory, keeps its previous output and state, and tries again next cycle.
 */
@Getter
public class SourceResolutionException extends BaseException {

    private final ResolutionFailure failure;
    private final SourceReference reference;

    /** Alias whose binding failed; null when resolving outside a binding table. */
    private final String alias;

    public SourceResolutionException(ResolutionFailure failure, SourceReference reference, String message) {
        this(failure, reference, null, message, null);
    }

    public SourceResolutionException(
            ResolutionFailure failure, SourceReference reference, String message, Throwable cause) {
        this(failure, reference, null, message, cause);
    }

    private SourceResolutionException(
            ResolutionFailure failure, SourceReference reference, String alias, String message, Throwable cause) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, details(failure, reference, alias), cause);
        this.failure = failure;
        this.reference = reference;
        this.alias = alias;
    }

    /** Same failure, attributed to the binding alias that triggered it. */
    public SourceResolutionException forAlias(String alias) {
        return new SourceResolutionException(
                failure, reference, alias, "Variable '" + alias + "': " + getMessage(), getCause());
    }

    private static Map<String, Object> details(ResolutionFailure failure, SourceReference reference, String alias) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failure", failure.name());
        details.put("reference", String.valueOf(reference));
        if (alias != null) {
            details.put("alias", alias);
        }
        return details;
    }
}
