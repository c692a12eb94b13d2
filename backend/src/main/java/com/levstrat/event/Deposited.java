package com.levstrat.event;

import java.math.BigInteger;

public record Deposited(
        String strategy,
        String depositToken,
        BigInteger depositAmount,
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount,
        int commandCount
) implements StrategyEvent {
}
