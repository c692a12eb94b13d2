package com.levstrat.web3;

import com.levstrat.oracle.PriceFeedReader;
import com.levstrat.oracle.RoundData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads Chainlink AggregatorV3 feeds over JSON-RPC.
 * All calls go through {@link Web3ClientFactory#executeWithFailover} so rate limits
 * and transport errors move to the next endpoint.
 */
@Slf4j
@RequiredArgsConstructor
public class Web3PriceFeedReader implements PriceFeedReader {

    private final Web3ClientFactory factory;
    private final String network;

    @Override
    @SuppressWarnings("rawtypes")
    public RoundData latestRoundData(String feed) {
        Function fn = new Function("latestRoundData", Collections.emptyList(), Arrays.asList(
                new TypeReference<Uint80>() {},
                new TypeReference<Int256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint80>() {}));

        List<Type> out = factory.executeWithFailover(network, web3 -> ViewCalls.call(web3, feed, fn));
        RoundData round = new RoundData(
                (BigInteger) out.get(0).getValue(),
                (BigInteger) out.get(1).getValue(),
                (BigInteger) out.get(2).getValue(),
                (BigInteger) out.get(3).getValue(),
                (BigInteger) out.get(4).getValue());
        log.debug("[feed] {} round={} answer={} updatedAt={}", feed, round.roundId(), round.answer(), round.updatedAt());
        return round;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public int decimals(String feed) {
        Function fn = new Function("decimals", Collections.emptyList(),
                Collections.singletonList(new TypeReference<Uint8>() {}));
        List<Type> out = factory.executeWithFailover(network, web3 -> ViewCalls.call(web3, feed, fn));
        return ((BigInteger) out.get(0).getValue()).intValueExact();
    }
}
