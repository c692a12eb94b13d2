package com.levstrat.exception;

import lombok.Getter;

/**
 * Base of every failure raised by the engine. {@code code} is a stable, machine-readable
 * identifier (e.g. {@code InvalidToken}); the message carries the offending values.
 */
@Getter
public class StrategyException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public StrategyException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public StrategyException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }
}
