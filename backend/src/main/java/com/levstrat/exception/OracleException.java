package com.levstrat.exception;

/** Stale, invalid or missing price, or inconsistent token configuration in the oracle. */
public class OracleException extends StrategyException {

    public static final String PRICE_FEED_NOT_FOUND = "PriceFeedNotFound";
    public static final String PRICE_DATA_TOO_OLD = "PriceDataTooOld";
    public static final String INVALID_PRICE = "InvalidPrice";
    public static final String INVALID_PRICE_FEED = "InvalidPriceFeed";
    public static final String INVALID_MARKET = "InvalidMarket";
    public static final String INVALID_UNDERLYING = "InvalidUnderlying";
    public static final String UNDERLYING_MISSING_PRICE_FEED = "UnderlyingMissingPriceFeed";
    public static final String DECIMALS_MISMATCH = "DecimalsMismatch";
    public static final String INVALID_CONFIGURATION = "InvalidConfiguration";
    public static final String ORACLE_UNAVAILABLE = "OracleUnavailable";

    public OracleException(String code, String message) {
        super(ErrorKind.ORACLE, code, message);
    }

    public OracleException(String code, String message, Throwable cause) {
        super(ErrorKind.ORACLE, code, message, cause);
    }
}
