package com.levstrat.strategy;

import com.levstrat.command.Command;

import java.math.BigInteger;
import java.util.List;

/**
 * @param providedAmount funds of {@code flashLoanToken} the parent advanced into the strategy for this call
 * @param expectedAmount funds of {@code flashLoanToken} the parent collects back afterwards
 */
public record DepositParams(
        String depositToken,
        BigInteger depositAmount,
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount,
        List<Command> commands
) {
    public DepositParams {
        depositAmount = depositAmount == null ? BigInteger.ZERO : depositAmount;
        providedAmount = providedAmount == null ? BigInteger.ZERO : providedAmount;
        expectedAmount = expectedAmount == null ? BigInteger.ZERO : expectedAmount;
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
