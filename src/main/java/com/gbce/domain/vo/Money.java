package com.gbce.domain.vo;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Immutable value object representing a monetary amount as a whole number of pennies.
 * Prices, par values and dividends all enter the exchange in this form; decimal
 * arithmetic on top of it goes through {@link Decimals}.
 */
@Value
public class Money {

    public static final BigDecimal PENNIES_PER_POUND = BigDecimal.valueOf(100);

    long pennies;

    public static Money ofPennies(long pennies) {
        return new Money(pennies);
    }

    public static Money zero() {
        return new Money(0L);
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(pennies);
    }

    /** Converts to pounds without rounding (e.g. 9550 -> 95.50). */
    public BigDecimal toPounds() {
        return BigDecimal.valueOf(pennies, 2);
    }

    public boolean isPositive() {
        return pennies > 0;
    }

    public boolean isNegative() {
        return pennies < 0;
    }

    public boolean isZero() {
        return pennies == 0;
    }
}
