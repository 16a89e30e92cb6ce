/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.prw.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Numeric value of a {@link Datapoint}. Holds either an integer or a floating point value, never both.
 */
@EqualsAndHashCode(doNotUseGetters = true)
@ToString(doNotUseGetters = true)
public final class DatapointValue {
    private static final double TWO_POW_63 = 0x1p63;

    private final Long intValue;
    private final Double floatValue;

    private DatapointValue(Long intValue, Double floatValue) {
        this.intValue = intValue;
        this.floatValue = floatValue;
    }

    /**
     * Integer when {@code value} has no fractional part and fits a signed 64-bit integer, floating point
     * otherwise. Infinities are floating point.
     */
    public static DatapointValue of(double value) {
        if (value >= -TWO_POW_63 && value < TWO_POW_63 && value == (double) (long) value) {
            return ofInt((long) value);
        }
        return ofFloat(value);
    }

    public static DatapointValue ofInt(long value) {
        return new DatapointValue(value, null);
    }

    public static DatapointValue ofFloat(double value) {
        return new DatapointValue(null, value);
    }

    public boolean isInteger() {
        return intValue != null;
    }

    public long getIntValue() {
        if (intValue == null) {
            throw new IllegalStateException("Not an integer value: " + floatValue);
        }
        return intValue;
    }

    public double getFloatValue() {
        if (floatValue == null) {
            throw new IllegalStateException("Not a floating point value: " + intValue);
        }
        return floatValue;
    }

    public double doubleValue() {
        return isInteger() ? intValue.doubleValue() : floatValue;
    }
}
