package com.levstrat.oracle;

import java.math.BigInteger;

/** Reads Pendle PT conversion rates (1e18 scale) averaged over {@code twapSeconds}. */
public interface PendleRateReader {

    BigInteger ptToAssetRate(String market, int twapSeconds);

    BigInteger ptToSyRate(String market, int twapSeconds);
}
