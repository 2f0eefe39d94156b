package com.gbce.domain.vo;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * The single rounding policy of the exchange.
 *
 * <p>Every published figure (dividend yield, VWSP, all-share index) is rounded exactly
 * once, to {@value #SCALE} fractional digits with {@link RoundingMode#HALF_UP}. Sums and
 * products leading up to the final division are kept exact; only non-terminating
 * quotients are bounded by {@link #PRECISION}.
 */
public final class Decimals {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /** Working precision for quotients that are not rounded to {@link #SCALE}. */
    public static final MathContext PRECISION = MathContext.DECIMAL128;

    private Decimals() {}

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    /** {@code numerator / denominator}, rounded once to the published scale. */
    public static BigDecimal divideRounded(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, SCALE, ROUNDING);
    }

    /** {@code numerator / denominator} as an unrounded ratio at working precision. */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, PRECISION);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
