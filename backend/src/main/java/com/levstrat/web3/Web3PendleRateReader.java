package com.levstrat.web3;

import com.levstrat.oracle.PendleRateReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Reads PT rates from the Pendle PY/LP oracle. */
@Slf4j
@RequiredArgsConstructor
public class Web3PendleRateReader implements PendleRateReader {

    private final Web3ClientFactory factory;
    private final String network;
    private final String pendleOracle;

    @Override
    public BigInteger ptToAssetRate(String market, int twapSeconds) {
        return readRate("getPtToAssetRate", market, twapSeconds);
    }

    @Override
    public BigInteger ptToSyRate(String market, int twapSeconds) {
        return readRate("getPtToSyRate", market, twapSeconds);
    }

    @SuppressWarnings("rawtypes")
    private BigInteger readRate(String method, String market, int twapSeconds) {
        Function fn = new Function(method,
                Arrays.asList(new Address(market), new Uint32(twapSeconds)),
                Collections.singletonList(new TypeReference<Uint256>() {}));
        List<Type> out = factory.executeWithFailover(network, web3 -> ViewCalls.call(web3, pendleOracle, fn));
        BigInteger rate = (BigInteger) out.get(0).getValue();
        log.debug("[pendle] {} market={} twap={}s rate={}", method, market, twapSeconds, rate);
        return rate;
    }
}
