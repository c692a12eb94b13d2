package com.levstrat.strategy;

import java.math.BigInteger;

/**
 * Breakdown behind {@code totalAssets}. USD fields carry 8 decimals;
 * {@code totalAssets} is in base-asset units.
 */
public record Valuation(
        BigInteger idleUsd,
        BigInteger collateralUsd,
        BigInteger debtUsd,
        BigInteger netUsd,
        BigInteger baseAssetPrice,
        BigInteger totalAssets
) {
}
