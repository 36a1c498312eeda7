package com.example.zeitpal.leave.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding shared by every leave calculator so that tie-breaking never differs
 * between entitlement, part-time and statutory figures.
 */
public final class LeaveRounding {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private LeaveRounding() {
    }

    /**
     * Nearest multiple of 0.5, ties rounded up (2.25 -> 2.5, 2.75 -> 3.0).
     * Non-finite input yields 0.
     */
    public static double toHalfDay(double value) {
        if (!Double.isFinite(value)) {
            return 0;
        }
        BigDecimal halves = BigDecimal.valueOf(value).multiply(TWO).setScale(0, RoundingMode.HALF_UP);
        return halves.doubleValue() / 2;
    }

    /**
     * Nearest whole day, ties away from zero.
     */
    public static double toWholeDay(double value) {
        if (!Double.isFinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).doubleValue();
    }
}
