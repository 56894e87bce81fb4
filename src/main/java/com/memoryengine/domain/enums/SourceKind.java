package com.memoryengine.domain.enums;

/**
 * Kind of live data a {@link com.memoryengine.domain.model.SourceReference} points at.
 *
 * <p>POINT references are keyed by the point's stable GUID. GLOBAL_VARIABLE references
 * are keyed by the variable's unique name.
 */
public enum SourceKind {
    /** Monitored/controlled field item, stored as {@code P:<guid>}. */
    POINT,
    /** Named process-wide scalar, stored as {@code GV:<name>}. */
    GLOBAL_VARIABLE
}
