package com.levstrat.strategy;

import com.levstrat.command.Command;

import java.math.BigInteger;
import java.util.List;

public record RebalanceParams(
        String flashLoanToken,
        BigInteger providedAmount,
        BigInteger expectedAmount,
        List<Command> commands
) {
    public RebalanceParams {
        providedAmount = providedAmount == null ? BigInteger.ZERO : providedAmount;
        expectedAmount = expectedAmount == null ? BigInteger.ZERO : expectedAmount;
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
