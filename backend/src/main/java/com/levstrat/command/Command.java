package com.levstrat.command;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * One step of an operator plan. None of the variants names a recipient: value can only
 * move between the strategy, its lending venue and a registered swap router.
 */
public sealed interface Command permits Command.Supply, Command.Withdraw, Command.Borrow, Command.Repay, Command.Swap {

    CommandType type();

    /** Supply {@code amount} of {@code asset} as collateral. */
    record Supply(String asset, BigInteger amount) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SUPPLY;
        }
    }

    /** Withdraw {@code amount} of {@code asset} collateral from the venue. */
    record Withdraw(String asset, BigInteger amount) implements Command {
        @Override
        public CommandType type() {
            return CommandType.WITHDRAW;
        }
    }

    record Borrow(String asset, BigInteger amount) implements Command {
        @Override
        public CommandType type() {
            return CommandType.BORROW;
        }
    }

    record Repay(String asset, BigInteger amount) implements Command {
        @Override
        public CommandType type() {
            return CommandType.REPAY;
        }
    }

    /**
     * Exchange through router {@code router} (registry id). {@code routerPayload} is passed to
     * the router untouched.
     */
    record Swap(int router,
                String tokenIn,
                BigInteger amountIn,
                String tokenOut,
                BigInteger minAmountOut,
                int maxOracleSlippageBps,
                byte[] routerPayload) implements Command {

        public Swap {
            routerPayload = routerPayload == null ? new byte[0] : routerPayload.clone();
        }

        @Override
        public byte[] routerPayload() {
            return routerPayload.clone();
        }

        @Override
        public CommandType type() {
            return CommandType.SWAP;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Swap s)) return false;
            return router == s.router
                    && maxOracleSlippageBps == s.maxOracleSlippageBps
                    && Objects.equals(tokenIn, s.tokenIn)
                    && Objects.equals(amountIn, s.amountIn)
                    && Objects.equals(tokenOut, s.tokenOut)
                    && Objects.equals(minAmountOut, s.minAmountOut)
                    && Arrays.equals(routerPayload, s.routerPayload);
        }

        @Override
        public int hashCode() {
            int h = Objects.hash(router, tokenIn, amountIn, tokenOut, minAmountOut, maxOracleSlippageBps);
            return 31 * h + Arrays.hashCode(routerPayload);
        }

        @Override
        public String toString() {
            return "Swap[router=" + router + ", tokenIn=" + tokenIn + ", amountIn=" + amountIn
                    + ", tokenOut=" + tokenOut + ", minAmountOut=" + minAmountOut
                    + ", maxOracleSlippageBps=" + maxOracleSlippageBps
                    + ", routerPayload=" + routerPayload.length + " bytes]";
        }
    }
}
