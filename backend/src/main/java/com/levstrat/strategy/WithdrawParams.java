package com.levstrat.strategy;

import com.levstrat.command.Command;

import java.math.BigInteger;
import java.util.List;

/**
 * @param percentage share of the position to unwind, 1e18 = 100%
 * @param commands   operator clean-up plan; only SWAP commands are accepted
 */
public record WithdrawParams(
        BigInteger percentage,
        String outputToken,
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount,
        List<Command> commands
) {
    public WithdrawParams {
        providedAmount = providedAmount == null ? BigInteger.ZERO : providedAmount;
        expectedAmount = expectedAmount == null ? BigInteger.ZERO : expectedAmount;
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
