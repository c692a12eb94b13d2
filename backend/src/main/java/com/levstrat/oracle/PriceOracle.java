package com.levstrat.oracle;

import java.math.BigInteger;

/**
 * USD price source. All USD amounts are fixed point with 8 decimals.
 * Implementations reject stale or non-positive quotes instead of returning them.
 */
public interface PriceOracle {

    /** USD value of {@code amount} base units of {@code token}. */
    BigInteger valueOf(String token, BigInteger amount);

    /** USD price of one whole {@code token}. */
    BigInteger priceOf(String token);

    /** Identifier reported in oracle-change events. */
    default String name() {
        return getClass().getSimpleName();
    }
}
