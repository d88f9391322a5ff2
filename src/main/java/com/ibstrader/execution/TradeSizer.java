package com.ibstrader.execution;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Order size and price arithmetic. Sizes are rounded to the instrument's size decimals,
 * prices to whole units.
 */
public final class TradeSizer {

    private TradeSizer() {}

    /**
     * Size of an opening order: {@code withdrawable * leverage / mid * safetyBuffer},
     * rounded down so the order never needs more margin than is available.
     */
    public static BigDecimal openSize(
            BigDecimal withdrawable, BigDecimal leverage, BigDecimal mid, BigDecimal safetyBuffer, int sizeDecimals) {
        if (mid.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal notional = withdrawable.multiply(leverage);
        BigDecimal size = notional.divide(mid, MathContext.DECIMAL128).multiply(safetyBuffer);
        return size.setScale(sizeDecimals, RoundingMode.DOWN);
    }

    /** Size of a closing order: the absolute position, at the instrument's precision. */
    public static BigDecimal closeSize(BigDecimal position, int sizeDecimals) {
        return position.abs().setScale(sizeDecimals, RoundingMode.HALF_EVEN);
    }

    /** Limit price for a quote at {@code mid}: nearest whole unit. */
    public static BigDecimal limitPrice(BigDecimal mid) {
        return mid.setScale(0, RoundingMode.HALF_EVEN);
    }
}
