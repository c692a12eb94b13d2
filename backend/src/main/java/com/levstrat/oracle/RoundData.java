package com.levstrat.oracle;

import java.math.BigInteger;

/** Result of an aggregator's {@code latestRoundData()}; timestamps are unix seconds. */
public record RoundData(
        BigInteger roundId,
        BigInteger answer,
        BigInteger startedAt,
        BigInteger updatedAt,
        BigInteger answeredInRound
) {
}
