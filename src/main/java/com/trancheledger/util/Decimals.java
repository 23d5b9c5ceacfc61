package com.trancheledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Shared BigDecimal arithmetic for ledger figures. Ratios and per-share values use a fixed scale
 * so repeated runs produce identical digits.
 */
public final class Decimals {

    public static final int SCALE = 10;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private Decimals() {}

    /** Null-safe zero default. */
    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /** Divides at {@link #SCALE}, returning zero when the divisor is zero or null. */
    public static BigDecimal safeDivide(BigDecimal dividend, BigDecimal divisor) {
        if (dividend == null || divisor == null || divisor.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, SCALE, ROUNDING);
    }

    /** Clamps into [min, max]. */
    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        if (value.compareTo(min) < 0) {
            return min;
        }
        if (value.compareTo(max) > 0) {
            return max;
        }
        return value;
    }
}
