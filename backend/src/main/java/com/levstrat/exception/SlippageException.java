package com.levstrat.exception;

import lombok.Getter;

import java.math.BigInteger;

/** A swap produced less than one of its floors. */
@Getter
public class SlippageException extends StrategyException {

    public static final String SLIPPAGE_TOO_HIGH = "SlippageTooHigh";
    public static final String ORACLE_SLIPPAGE_CHECK_FAILED = "OracleSlippageCheckFailed";

    private final BigInteger actual;
    private final BigInteger minimum;

    private SlippageException(String code, String message, BigInteger actual, BigInteger minimum) {
        super(ErrorKind.SLIPPAGE, code, message);
        this.actual = actual;
        this.minimum = minimum;
    }

    public static SlippageException belowMinOut(BigInteger amountOut, BigInteger minAmountOut) {
        return new SlippageException(SLIPPAGE_TOO_HIGH,
                "amountOut " + amountOut + " < minAmountOut " + minAmountOut, amountOut, minAmountOut);
    }

    public static SlippageException belowOracleFloor(BigInteger usdOut, BigInteger usdFloor) {
        return new SlippageException(ORACLE_SLIPPAGE_CHECK_FAILED,
                "usdValueOut " + usdOut + " < oracle floor " + usdFloor, usdOut, usdFloor);
    }
}
