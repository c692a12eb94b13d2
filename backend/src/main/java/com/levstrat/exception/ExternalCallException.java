package com.levstrat.exception;

/** A router, lending venue or token call failed; the underlying reason is forwarded. */
public class ExternalCallException extends StrategyException {

    public static final String SWAP_FAILED = "SwapFailed";
    public static final String TRANSFER_FAILED = "TransferFailed";
    public static final String VENUE_CALL_FAILED = "VenueCallFailed";
    public static final String REENTRANT_CALL = "ReentrantCall";

    public ExternalCallException(String code, String message) {
        super(ErrorKind.EXTERNAL_CALL, code, message);
    }

    public ExternalCallException(String code, String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_CALL, code, message, cause);
    }
}
