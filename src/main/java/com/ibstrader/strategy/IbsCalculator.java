package com.ibstrader.strategy;

import com.ibstrader.domain.model.Bar;
import com.ibstrader.exception.InvalidBarException;
import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Internal Bar Strength: where the close sits inside the bar's range, {@code 0} at the
 * low and {@code 1} at the high.
 */
public final class IbsCalculator {

    private IbsCalculator() {}

    /** {@code clamp((close - low) / (high - low), 0, 1)}, or 0.5 for a bar with no range. */
    public static double ibs(BigDecimal close, BigDecimal low, BigDecimal high) {
        BigDecimal range = high.subtract(low);
        if (range.signum() == 0) {
            return 0.5;
        }
        double ibs = close.subtract(low).divide(range, MathContext.DECIMAL64).doubleValue();
        return Math.max(0.0, Math.min(ibs, 1.0));
    }

    /**
     * @throws InvalidBarException if a price is missing or high is below low
     */
    public static double ibs(Bar bar) {
        validate(bar);
        return ibs(bar.getClose(), bar.getLow(), bar.getHigh());
    }

    public static void validate(Bar bar) {
        if (bar.getTimestamp() == null
                || bar.getOpen() == null
                || bar.getHigh() == null
                || bar.getLow() == null
                || bar.getClose() == null) {
            throw new InvalidBarException("Bar has missing or non-finite fields: id=" + bar.getId());
        }
        if (bar.getHigh().compareTo(bar.getLow()) < 0) {
            throw new InvalidBarException(
                    "Bar high below low: id=" + bar.getId() + ", high=" + bar.getHigh() + ", low=" + bar.getLow());
        }
    }
}
