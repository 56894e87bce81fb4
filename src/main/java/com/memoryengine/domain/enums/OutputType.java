package com.memoryengine.domain.enums;

/**
 * How an IF memory's selected value is written to its destination.
 *
 * <p>DIGITAL collapses the value to on/off: any value with magnitude above
 * {@code 1e-10} is written as 1 (or {@code true}), everything else as 0 (or {@code false}).
 * ANALOG writes the numeric value unchanged.
 */
public enum OutputType {
    DIGITAL,
    ANALOG
}
