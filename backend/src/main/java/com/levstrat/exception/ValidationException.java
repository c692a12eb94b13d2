package com.levstrat.exception;

/**
 * Bad input: zero address/amount, out-of-range percentage, unknown or disallowed command,
 * malformed payload.
 */
public class ValidationException extends StrategyException {

    public static final String INVALID_TOKEN = "InvalidToken";
    public static final String INVALID_AMOUNT = "InvalidAmount";
    public static final String INVALID_PERCENTAGE = "InvalidPercentage";
    public static final String INVALID_ROUTER = "InvalidRouter";
    public static final String UNKNOWN_COMMAND = "UnknownCommand";
    public static final String INVALID_KEEPER_COMMAND = "InvalidKeeperCommand";
    public static final String MALFORMED_COMMAND = "MalformedCommand";
    public static final String ZERO_ADDRESS = "ZeroAddress";

    public ValidationException(String code, String message) {
        super(ErrorKind.VALIDATION, code, message);
    }

    public ValidationException(String code, String message, Throwable cause) {
        super(ErrorKind.VALIDATION, code, message, cause);
    }

    public static ValidationException invalidToken(String token) {
        return new ValidationException(INVALID_TOKEN, "invalid token: " + token);
    }

    public static ValidationException invalidAmount(String message) {
        return new ValidationException(INVALID_AMOUNT, message);
    }
}
