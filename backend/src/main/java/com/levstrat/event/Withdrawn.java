package com.levstrat.event;

import java.math.BigInteger;

/** {@code percentage} is 1e18-scaled; {@code actualWithdrawn} excludes the flash-loan repayment. */
public record Withdrawn(
        String strategy,
        BigInteger percentage,
        String outputToken,
        BigInteger actualWithdrawn,
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount
) implements StrategyEvent {
}
