package com.levstrat.web3;

import com.levstrat.config.AppProps;
import com.levstrat.oracle.RoundData;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class Web3PriceFeedReaderTest {

    private static final String FEED = "0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419";

    @Test
    void latestRoundData_decodesAggregatorTuple() throws IOException {
        Web3j web3 = web3Returning(ethCall(FunctionEncoder.encodeConstructor(Arrays.asList(
                new Uint80(BigInteger.valueOf(42)),
                new Int256(new BigInteger("200000000000")),
                new Uint256(BigInteger.valueOf(1_700_000_000)),
                new Uint256(BigInteger.valueOf(1_700_000_100)),
                new Uint80(BigInteger.valueOf(42))))));
        Web3PriceFeedReader reader = new Web3PriceFeedReader(factory(List.of("http://a"), url -> web3), "mainnet");

        RoundData round = reader.latestRoundData(FEED);

        assertThat(round.roundId()).isEqualTo(BigInteger.valueOf(42));
        assertThat(round.answer()).isEqualTo(new BigInteger("200000000000"));
        assertThat(round.updatedAt()).isEqualTo(BigInteger.valueOf(1_700_000_100));
    }

    @Test
    void decimals_decodesUint8() throws IOException {
        Web3j web3 = web3Returning(ethCall(FunctionEncoder.encodeConstructor(List.of(new Uint8(8)))));
        Web3PriceFeedReader reader = new Web3PriceFeedReader(factory(List.of("http://a"), url -> web3), "mainnet");

        assertThat(reader.decimals(FEED)).isEqualTo(8);
    }

    @Test
    void decimals_failsOverToNextEndpointOnTransportError() throws IOException {
        Web3j broken = mock(Web3j.class);
        Request<?, EthCall> failing = mockRequest();
        when(failing.send()).thenThrow(new IOException("connection reset"));
        doReturn(failing).when(broken).ethCall(any(), any());
        Web3j healthy = web3Returning(ethCall(FunctionEncoder.encodeConstructor(List.of(new Uint8(18)))));

        Web3ClientFactory factory = factory(List.of("http://broken", "http://healthy"),
                url -> url.contains("broken") ? broken : healthy);

        assertThat(new Web3PriceFeedReader(factory, "mainnet").decimals(FEED)).isEqualTo(18);
    }

    @Test
    void decimals_doesNotRetryRevert() throws IOException {
        EthCall error = new EthCall();
        error.setError(new Response.Error(3, "execution reverted"));
        Web3j web3 = web3Returning(error);

        Web3PriceFeedReader reader = new Web3PriceFeedReader(factory(List.of("http://a"), url -> web3), "mainnet");

        assertThatThrownBy(() -> reader.decimals(FEED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("execution reverted");
    }

    private static Web3ClientFactory factory(List<String> urls, Function<String, Web3j> connector) {
        AppProps props = new AppProps();
        AppProps.Network network = new AppProps.Network();
        network.setRpcUrls(urls);
        network.getFailover().setBaseBackoff(Duration.ofMillis(1));
        network.getFailover().setMaxBackoff(Duration.ofMillis(1));
        props.setNetwork(Map.of("mainnet", network));
        return new Web3ClientFactory(props, connector);
    }

    private static Web3j web3Returning(EthCall result) throws IOException {
        Web3j web3 = mock(Web3j.class);
        Request<?, EthCall> request = mockRequest();
        when(request.send()).thenReturn(result);
        doReturn(request).when(web3).ethCall(any(), any());
        return web3;
    }

    @SuppressWarnings("unchecked")
    private static Request<?, EthCall> mockRequest() {
        return mock(Request.class);
    }

    private static EthCall ethCall(String hex) {
        EthCall call = new EthCall();
        call.setResult(hex.startsWith("0x") ? hex : "0x" + hex);
        return call;
    }
}
