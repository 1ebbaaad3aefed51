package com.example.calculator;

/**
 * Renders calculator results, printing whole numbers without a fractional part.
 */
public final class ResultFormatter {
    private static final double LONG_RANGE = 0x1p63;

    private ResultFormatter() {
    }

    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && value >= -LONG_RANGE && value < LONG_RANGE) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
