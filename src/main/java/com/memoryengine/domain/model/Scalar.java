package com.memoryengine.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A live value as seen by the IF-memory engine: either a boolean or a number.
 *
 * <p>Conversions between the two are explicit and total: {@link #asNumber()} maps
 * true/false to 1/0, {@link #asBoolean()} treats any number with magnitude above
 * {@link #ZERO_TOLERANCE} as true. Nothing converts implicitly.
 */
@Getter
@EqualsAndHashCode
public final class Scalar {

    /** Magnitude at or below which a number counts as zero/false. */
    public static final double ZERO_TOLERANCE = 1e-10;

    public enum Type {
        BOOL,
        NUMBER
    }

    private final Type type;
    private final boolean boolValue;
    private final double numberValue;

    private Scalar(Type type, boolean boolValue, double numberValue) {
        this.type = type;
        this.boolValue = boolValue;
        this.numberValue = numberValue;
    }

    public static Scalar bool(boolean value) {
        return new Scalar(Type.BOOL, value, 0.0);
    }

    public static Scalar number(double value) {
        return new Scalar(Type.NUMBER, false, value);
    }

    public boolean isBool() {
        return type == Type.BOOL;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public double asNumber() {
        if (isBool()) {
            return boolValue ? 1.0 : 0.0;
        }
        return numberValue;
    }

    public boolean asBoolean() {
        if (isBool()) {
            return boolValue;
        }
        return isNonZero(numberValue);
    }

    /** Value handed to the condition evaluator: {@link Boolean} or {@link Double}. */
    public Object toEvaluationValue() {
        return isBool() ? Boolean.valueOf(boolValue) : Double.valueOf(numberValue);
    }

    public static boolean isNonZero(double value) {
        return Math.abs(value) > ZERO_TOLERANCE;
    }

    @Override
    public String toString() {
        return isBool() ? String.valueOf(boolValue) : String.valueOf(numberValue);
    }
}
