package com.memoryengine.domain.enums;

/**
 * Runtime health of one IF memory instance as seen by the engine.
 *
 * <p>DISABLED instances have no timer. IDLE instances are scheduled but have not
 * completed a cycle yet. HEALTHY means the last cycle evaluated and committed cleanly.
 * DEGRADED means the last cycle hit a recoverable problem (branch warning, commit
 * failure, or a resolution failure below the stale threshold). STALE means bindings
 * have failed to resolve for several consecutive cycles and the destination holds
 * an old value.
 */
public enum EvaluationStatus {
    DISABLED,
    IDLE,
    HEALTHY,
    DEGRADED,
    STALE
}
