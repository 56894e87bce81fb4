package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.SourceKind;
import com.memoryengine.ifmemory.SourceReferenceCodec;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Typed pointer to live data: either a point (by GUID) or a global variable (by name).
 *
 * <p>Instances are immutable and compare by value, so two references to the same
 * point are equal regardless of how they were decoded (prefixed or legacy form).
 * The wire form is produced by {@link SourceReferenceCodec}.
 */
@Getter
@EqualsAndHashCode
public final class SourceReference {

    private final SourceKind kind;
    private final String locator;

    private SourceReference(SourceKind kind, String locator) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.locator = Objects.requireNonNull(locator, "locator");
    }

    public static SourceReference of(SourceKind kind, String locator) {
        return new SourceReference(kind, locator);
    }

    public static SourceReference point(String pointId) {
        return new SourceReference(SourceKind.POINT, pointId);
    }

    public static SourceReference globalVariable(String name) {
        return new SourceReference(SourceKind.GLOBAL_VARIABLE, name);
    }

    public boolean isPoint() {
        return kind == SourceKind.POINT;
    }

    public boolean isGlobalVariable() {
        return kind == SourceKind.GLOBAL_VARIABLE;
    }

    @Override
    public String toString() {
        return SourceReferenceCodec.encode(this);
    }
}
