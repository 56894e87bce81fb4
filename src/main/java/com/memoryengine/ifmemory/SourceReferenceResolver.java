package com.memoryengine.ifmemory;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.ResolutionFailure;
import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.PointSample;
import com.memoryengine.domain.model.Scalar;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.exception.LiveStoreTimeoutException;
import com.memoryengine.exception.SourceResolutionException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link SourceReference} to the current live {@link Scalar}.
 *
 * <p>Conversion rules: a point sample is always a number; a BOOLEAN global variable
 * is a bool; a FLOAT global variable is a number. Stored text that does not parse as
 * its declared type is a {@link ResolutionFailure#TYPE_MISMATCH}. Disabled global
 * variables have no live record and therefore resolve as {@link ResolutionFailure#NOT_FOUND}.
 */
@Component
public class SourceReferenceResolver {

    private final LiveValueStore liveValueStore;
    private final BoundedStoreAccess boundedStoreAccess;

    public SourceReferenceResolver(LiveValueStore liveValueStore, BoundedStoreAccess boundedStoreAccess) {
        this.liveValueStore = liveValueStore;
        this.boundedStoreAccess = boundedStoreAccess;
    }

    /**
     * @throws SourceResolutionException if the source is unknown, has no usable value,
     *     holds text of the wrong type, or the store did not answer in time
     */
    public Scalar resolve(SourceReference reference) {
        return reference.isPoint() ? resolvePoint(reference) : resolveGlobalVariable(reference);
    }

    private Scalar resolvePoint(SourceReference reference) {
        PointSample sample = read(reference, () -> liveValueStore.findPoint(reference.getLocator()))
                .orElseThrow(() -> new SourceResolutionException(
                        ResolutionFailure.NOT_FOUND, reference, "Point " + reference.getLocator() + " not found"));

        Double value = sample.getValue();
        if (value == null || !Double.isFinite(value)) {
            throw new SourceResolutionException(
                    ResolutionFailure.STALE_OR_UNAVAILABLE,
                    reference,
                    "Point " + reference.getLocator() + " has no sampled value");
        }
        return Scalar.number(value);
    }

    private Scalar resolveGlobalVariable(SourceReference reference) {
        GlobalVariableValue record = read(reference, () -> liveValueStore.findGlobalVariable(reference.getLocator()))
                .orElseThrow(() -> new SourceResolutionException(
                        ResolutionFailure.NOT_FOUND,
                        reference,
                        "Global variable " + reference.getLocator() + " not found"));

        String text = record.getValue();
        if (text == null) {
            throw new SourceResolutionException(
                    ResolutionFailure.STALE_OR_UNAVAILABLE,
                    reference,
                    "Global variable " + reference.getLocator() + " has no value");
        }
        return record.getVariableType() == GlobalVariableType.BOOLEAN
                ? parseBoolean(reference, text)
                : parseNumber(reference, text);
    }

    /** Parses {@code true}/{@code false} (any case, surrounding blanks ignored). */
    static Optional<Boolean> parseBooleanText(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equals(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /** Parses a finite decimal number. */
    static Optional<Double> parseNumberText(String text) {
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Scalar parseBoolean(SourceReference reference, String text) {
        return parseBooleanText(text)
                .map(Scalar::bool)
                .orElseThrow(() -> typeMismatch(reference, text, "a boolean"));
    }

    private static Scalar parseNumber(SourceReference reference, String text) {
        return parseNumberText(text)
                .map(Scalar::number)
                .orElseThrow(() -> typeMismatch(reference, text, "a number"));
    }

    private static SourceResolutionException typeMismatch(SourceReference reference, String text, String expected) {
        return new SourceResolutionException(
                ResolutionFailure.TYPE_MISMATCH,
                reference,
                "Global variable " + reference.getLocator() + " holds '" + text + "', expected " + expected);
    }

    private <T> T read(SourceReference reference, Supplier<T> call) {
        try {
            return boundedStoreAccess.read("read " + reference, call);
        } catch (LiveStoreTimeoutException e) {
            throw new SourceResolutionException(ResolutionFailure.TIMEOUT, reference, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SourceResolutionException(
                    ResolutionFailure.STALE_OR_UNAVAILABLE, reference, "Live store unavailable: " + e.getMessage(), e);
        }
    }
}
