package com.memoryengine.domain.enums;

/** Reason a source reference could not be turned into a live value. */
public enum ResolutionFailure {
    /** Unknown point id, or undefined/disabled global variable. */
    NOT_FOUND,
    /** Point exists but has never been sampled. */
    STALE_OR_UNAVAILABLE,
    /** Store did not answer within the configured time limit. */
    TIMEOUT,
    /** Stored value cannot be converted to the expected scalar type. */
    TYPE_MISMATCH
}
