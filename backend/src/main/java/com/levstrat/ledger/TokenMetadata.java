package com.levstrat.ledger;

/** Static token attributes. */
public interface TokenMetadata {

    int decimals(String token);

    String symbol(String token);
}
