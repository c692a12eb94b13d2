package com.levstrat.event;

import java.math.BigInteger;

public record Rebalanced(
        String strategy,
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount,
        int commandCount
) implements StrategyEvent {
}
