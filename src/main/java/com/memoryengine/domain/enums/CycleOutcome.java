package com.memoryengine.domain.enums;

/** Result of one evaluation cycle of an IF memory. */
public enum CycleOutcome {
    /** Value selected and written to the destination. */
    COMMITTED,
    /** Cycle skipped: a binding failed to resolve. Previous output and state kept. */
    RESOLUTION_FAILED,
    /** Value selected but the destination write failed. Retried next cycle. */
    COMMIT_FAILED,
    /** Instance is disabled or the engine is switched off. */
    SKIPPED
}
