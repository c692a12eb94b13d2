package com.levstrat.util;

import java.math.BigInteger;

/**
 * Integer fixed-point helpers (uint256 semantics, round down unless stated).
 */
public final class FixedPoint {
    private FixedPoint() {}

    /** 1e18 == 100% for withdrawal percentages. */
    public static final BigInteger PERCENTAGE_DENOMINATOR = BigInteger.TEN.pow(18);

    /** 10_000 bps == 100% for slippage tolerances. */
    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    /** Oracle USD values carry 8 decimals. */
    public static final int USD_DECIMALS = 8;

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        return a.multiply(b).divide(denominator);
    }

    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    public static BigInteger pow10(int exp) {
        return BigInteger.TEN.pow(exp);
    }

    /** Rescales a fixed-point value from {@code fromDecimals} to {@code toDecimals}. */
    public static BigInteger rescale(BigInteger value, int fromDecimals, int toDecimals) {
        if (fromDecimals == toDecimals) return value;
        if (fromDecimals < toDecimals) return value.multiply(pow10(toDecimals - fromDecimals));
        return value.divide(pow10(fromDecimals - toDecimals));
    }

    /** a - b, floored at zero. */
    public static BigInteger subFloor(BigInteger a, BigInteger b) {
        BigInteger d = a.subtract(b);
        return d.signum() < 0 ? BigInteger.ZERO : d;
    }

    public static boolean isPositive(BigInteger v) {
        return v != null && v.signum() > 0;
    }

    public static BigInteger orZero(BigInteger v) {
        return v == null ? BigInteger.ZERO : v;
    }
}
