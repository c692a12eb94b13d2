package com.levstrat.event;

import java.math.BigInteger;

/** Raw amounts plus both oracle USD values (8 decimals), enough to reconstruct the swap's price. */
public record SwapExecuted(
        String strategy,
        String router,
        String tokenIn,
        BigInteger amountIn,
        String tokenOut,
        BigInteger amountOut,
        BigInteger usdValueIn,
        BigInteger usdValueOut
) implements StrategyEvent {
}
