package com.levstrat.exception;

/** Caller is not the strategy's parent. */
public class UnauthorizedException extends StrategyException {

    public UnauthorizedException(String caller) {
        super(ErrorKind.AUTHORIZATION, "Unauthorized", "caller " + caller + " is not the parent");
    }
}
