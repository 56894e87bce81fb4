package com.memoryengine.ifmemory;

import com.memoryengine.domain.enums.SourceKind;
import com.memoryengine.domain.model.SourceReference;

/**
 * Wire/storage codec for {@link SourceReference}.
 *
 * <p>Format: {@code "P:" + guid} for points, {@code "GV:" + name} for global variables.
 * A string without a recognized prefix is legacy data written before global variables
 * existed and always decodes as a point. {@link #encode} always writes a prefix.
 */
public final class SourceReferenceCodec {

    public static final String POINT_PREFIX = "P:";
    public static final String GLOBAL_VARIABLE_PREFIX = "GV:";

    private SourceReferenceCodec() {}

    /**
     * Decodes a stored reference.
     *
     * @throws IllegalArgumentException if {@code encoded} is null/blank or the part
     *     after the prefix is blank
     */
    public static SourceReference decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Source reference is blank");
        }

        SourceKind kind;
        String locator;
        if (encoded.startsWith(POINT_PREFIX)) {
            kind = SourceKind.POINT;
            locator = encoded.substring(POINT_PREFIX.length());
        } else if (encoded.startsWith(GLOBAL_VARIABLE_PREFIX)) {
            kind = SourceKind.GLOBAL_VARIABLE;
            locator = encoded.substring(GLOBAL_VARIABLE_PREFIX.length());
        } else {
            kind = SourceKind.POINT;
            locator = encoded;
        }

        if (locator.isBlank()) {
            throw new IllegalArgumentException("Source reference '" + encoded + "' has no locator");
        }
        return SourceReference.of(kind, locator);
    }

    public static String encode(SourceReference reference) {
        String prefix = reference.getKind() == SourceKind.POINT ? POINT_PREFIX : GLOBAL_VARIABLE_PREFIX;
        return prefix + reference.getLocator();
    }

    /** True if {@code encoded} carries neither recognized prefix. */
    public static boolean isLegacy(String encoded) {
        return encoded != null
                && !encoded.startsWith(POINT_PREFIX)
                && !encoded.startsWith(GLOBAL_VARIABLE_PREFIX);
    }
}
