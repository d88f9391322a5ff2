package com.ibstrader.strategy;

/**
 * Leverage as a decreasing function of IBS: {@code base * (1 - ibs)^exponent}, bounded
 * to {@code [1, min(base, maxLeverage)]} and rounded half-even to a whole number.
 */
public final class LeverageCalculator {

    private LeverageCalculator() {}

    public static int leverage(double ibs, double base, double exponent, int maxLeverage) {
        double raw = base * Math.pow(1.0 - ibs, exponent);
        double bounded = Math.max(1.0, Math.min(raw, base));
        int rounded = (int) Math.rint(bounded);
        return Math.max(1, Math.min(rounded, maxLeverage));
    }
}
