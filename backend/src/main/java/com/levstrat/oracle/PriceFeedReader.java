package com.levstrat.oracle;

/** Reads Chainlink-style aggregator feeds. */
public interface PriceFeedReader {

    RoundData latestRoundData(String feed);

    int decimals(String feed);
}
