package com.levstrat.exception;

import lombok.Getter;

import java.math.BigInteger;

/** A tracked balance dropped by more than its share of the withdrawn percentage. */
@Getter
public class ProportionalityException extends StrategyException {

    private final String token;
    private final BigInteger balance;
    private final BigInteger required;

    public ProportionalityException(String token, BigInteger balance, BigInteger required) {
        super(ErrorKind.PROPORTIONALITY, ValidationException.INVALID_AMOUNT,
                "balance of " + token + " is " + balance + ", at least " + required + " required");
        this.token = token;
        this.balance = balance;
        this.required = required;
    }
}
