package com.memoryengine.domain.enums;

/**
 * Item type of a point as reported by the live store.
 *
 * <p>Only output items can be the destination of an IF memory: DIGITAL_OUTPUT for
 * {@link OutputType#DIGITAL}, ANALOG_OUTPUT for {@link OutputType#ANALOG}.
 */
public enum PointItemType {
    DIGITAL_INPUT,
    DIGITAL_OUTPUT,
    ANALOG_INPUT,
    ANALOG_OUTPUT;

    public boolean isOutput() {
        return this == DIGITAL_OUTPUT || this == ANALOG_OUTPUT;
    }
}
