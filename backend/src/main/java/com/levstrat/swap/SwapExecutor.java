package com.levstrat.swap;

import com.levstrat.command.Command;
import com.levstrat.event.StrategyEventSink;
import com.levstrat.event.SwapExecuted;
import com.levstrat.exception.ExternalCallException;
import com.levstrat.exception.SlippageException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.oracle.PriceOracle;
import com.levstrat.util.AddressUtil;
import com.levstrat.util.FixedPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Executes one token-for-token exchange through a registered router with two independent floors:
 *  1) {@code amountOut >= minAmountOut} (operator's execution-quality expectation);
 *  2) {@code usd(amountOut) >= usd(amountIn) * (1 - maxOracleSlippageBps / 10_000)}.
 *
 * The router receives an allowance of exactly {@code amountIn}; the allowance is zero again when
 * this method returns or throws. {@code amountOut} is the observed balance delta.
 */
@Slf4j
@RequiredArgsConstructor
public class SwapExecutor {

    private final String account;
    private final TokenLedger ledger;
    private final RouterRegistry routers;
    private final Supplier<PriceOracle> oracle;
    private final StrategyEventSink events;

    public BigInteger swap(Command.Swap s) {
        if (AddressUtil.isZero(s.tokenIn()) || AddressUtil.isZero(s.tokenOut())) {
            throw ValidationException.invalidToken(AddressUtil.isZero(s.tokenIn()) ? s.tokenIn() : s.tokenOut());
        }
        if (!FixedPoint.isPositive(s.amountIn())) {
            throw ValidationException.invalidAmount("amountIn must be positive: " + s.amountIn());
        }
        if (s.minAmountOut() == null || s.minAmountOut().signum() < 0) {
            throw ValidationException.invalidAmount("invalid minAmountOut: " + s.minAmountOut());
        }
        if (s.maxOracleSlippageBps() < 0 || s.maxOracleSlippageBps() > FixedPoint.BPS_DENOMINATOR.intValue()) {
            throw ValidationException.invalidAmount("maxOracleSlippageBps out of range: " + s.maxOracleSlippageBps());
        }
        SwapRouter router = routers.require(s.router());

        String tokenIn = AddressUtil.normalize(s.tokenIn());
        String tokenOut = AddressUtil.normalize(s.tokenOut());
        PriceOracle priceOracle = oracle.get();
        BigInteger usdIn = priceOracle.valueOf(tokenIn, s.amountIn());

        BigInteger amountOut;
        ledger.approve(tokenIn, account, router.address(), s.amountIn());
        try {
            BigInteger before = ledger.balanceOf(tokenOut, account);
            try {
                router.execute(account, s.routerPayload());
            } catch (RuntimeException e) {
                throw new ExternalCallException(ExternalCallException.SWAP_FAILED,
                        "router " + s.router() + " (" + router.address() + ") failed: " + e.getMessage(), e);
            }
            amountOut = FixedPoint.subFloor(ledger.balanceOf(tokenOut, account), before);
        } finally {
            ledger.approve(tokenIn, account, router.address(), BigInteger.ZERO);
        }

        if (amountOut.compareTo(s.minAmountOut()) < 0) {
            throw SlippageException.belowMinOut(amountOut, s.minAmountOut());
        }

        BigInteger usdOut = priceOracle.valueOf(tokenOut, amountOut);
        BigInteger usdFloor = FixedPoint.mulDiv(usdIn,
                FixedPoint.BPS_DENOMINATOR.subtract(BigInteger.valueOf(s.maxOracleSlippageBps())),
                FixedPoint.BPS_DENOMINATOR);
        if (usdOut.compareTo(usdFloor) < 0) {
            throw SlippageException.belowOracleFloor(usdOut, usdFloor);
        }

        log.info("[swap] router={} {} {} -> {} {} (usdIn={} usdOut={})",
                s.router(), s.amountIn(), tokenIn, amountOut, tokenOut, usdIn, usdOut);
        events.emit(new SwapExecuted(account, router.address(), tokenIn, s.amountIn(), tokenOut, amountOut, usdIn, usdOut));
        return amountOut;
    }
}
