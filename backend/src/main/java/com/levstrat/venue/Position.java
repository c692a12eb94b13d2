package com.levstrat.venue;

import java.math.BigInteger;

/** Live collateral and debt, in the respective assets' base units. */
public record Position(BigInteger collateral, BigInteger debt) {

    public static final Position EMPTY = new Position(BigInteger.ZERO, BigInteger.ZERO);
}
