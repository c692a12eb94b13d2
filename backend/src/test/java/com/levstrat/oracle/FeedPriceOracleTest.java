package com.levstrat.oracle;

import com.levstrat.exception.OracleException;
import com.levstrat.ledger.InMemoryTokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedPriceOracleTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String PT = "0x00000000000000000000000000000000000000a7";
    private static final String ETH_FEED = "0x5f4ec3df9cbd43714fe2740f5e3616155c5b8419";
    private static final String USDC_FEED = "0x8fffffd4afb6115b954bd326cbe7b4ba576818f6";
    private static final String MARKET = "0x00000000000000000000000000000000000000ee";

    @Mock
    private PriceFeedReader feeds;
    @Mock
    private PendleRateReader pendle;

    private final InMemoryTokenLedger tokens = new InMemoryTokenLedger();
    private FeedPriceOracle oracle;

    @BeforeEach
    void setUp() {
        tokens.registerToken(WETH, "WETH", 18);
        tokens.registerToken(USDC, "USDC", 6);
        tokens.registerToken(PT, "PT-USDC", 6);
        oracle = new FeedPriceOracle(feeds, pendle, tokens, Clock.fixed(NOW, ZoneOffset.UTC),
                FeedPriceOracle.DEFAULT_MAX_STALENESS, FeedPriceOracle.DEFAULT_TWAP_SECONDS);
        oracle.addPriceFeed(WETH, ETH_FEED);
        oracle.addPriceFeed(USDC, USDC_FEED);
    }

    @Test
    void valueOf_scalesByTokenDecimals() {
        feed(ETH_FEED, "200000000000", 8, NOW.minusSeconds(60));

        // 1.5 WETH at $2000
        BigInteger usd = oracle.valueOf(WETH, new BigInteger("1500000000000000000"));

        assertThat(usd).isEqualTo(new BigInteger("300000000000"));
    }

    @Test
    void priceOf_rescalesFeedDecimalsToEight() {
        feed(USDC_FEED, "999800000000000000", 18, NOW.minusSeconds(60));

        assertThat(oracle.priceOf(USDC)).isEqualTo(BigInteger.valueOf(99_980_000));
    }

    @Test
    void valueOf_zeroAmountSkipsFeed() {
        assertThat(oracle.valueOf(WETH, BigInteger.ZERO)).isZero();
        verify(feeds, never()).latestRoundData(ETH_FEED);
    }

    @Test
    void priceOf_rejectsStaleAnswer() {
        when(feeds.latestRoundData(ETH_FEED)).thenReturn(round("200000000000", NOW.minus(Duration.ofHours(25))));
        when(feeds.decimals(ETH_FEED)).thenReturn(8);

        assertThatThrownBy(() -> oracle.priceOf(WETH))
                .isInstanceOf(OracleException.class)
                .extracting("code").isEqualTo(OracleException.PRICE_DATA_TOO_OLD);
    }

    @Test
    void priceOf_rejectsNeverUpdatedRound() {
        when(feeds.latestRoundData(ETH_FEED)).thenReturn(new RoundData(BigInteger.ONE, BigInteger.TEN,
                BigInteger.ZERO, BigInteger.ZERO, BigInteger.ONE));
        when(feeds.decimals(ETH_FEED)).thenReturn(8);

        assertThatThrownBy(() -> oracle.priceOf(WETH))
                .extracting("code").isEqualTo(OracleException.PRICE_DATA_TOO_OLD);
    }

    @Test
    void priceOf_rejectsTimestampBeyondLongRange() {
        when(feeds.latestRoundData(ETH_FEED)).thenReturn(new RoundData(BigInteger.ONE, new BigInteger("200000000000"),
                BigInteger.ZERO, BigInteger.TWO.pow(255), BigInteger.ONE));
        when(feeds.decimals(ETH_FEED)).thenReturn(8);

        assertThatThrownBy(() -> oracle.priceOf(WETH))
                .isInstanceOf(OracleException.class)
                .extracting("code").isEqualTo(OracleException.INVALID_PRICE);
    }

    @Test
    void priceOf_rejectsNonPositiveAnswer() {
        when(feeds.latestRoundData(ETH_FEED)).thenReturn(round("-1", NOW));
        when(feeds.decimals(ETH_FEED)).thenReturn(8);

        assertThatThrownBy(() -> oracle.priceOf(WETH))
                .extracting("code").isEqualTo(OracleException.INVALID_PRICE);
    }

    @Test
    void priceOf_unknownTokenHasNoFeed() {
        assertThatThrownBy(() -> oracle.priceOf(PT))
                .isInstanceOf(OracleException.class)
                .extracting("code").isEqualTo(OracleException.PRICE_FEED_NOT_FOUND);
    }

    @Test
    void priceOf_wrapsReaderFailure() {
        when(feeds.latestRoundData(ETH_FEED)).thenThrow(new IllegalStateException("All RPC endpoints failed"));

        assertThatThrownBy(() -> oracle.priceOf(WETH))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("All RPC endpoints failed")
                .extracting("code").isEqualTo(OracleException.ORACLE_UNAVAILABLE);
    }

    @Test
    void ptToken_isPricedFromUnderlyingAndAssetRate() {
        oracle.addPtToken(PT, MARKET, false, USDC);
        feed(USDC_FEED, "100000000", 8, NOW);
        when(pendle.ptToAssetRate(MARKET, FeedPriceOracle.DEFAULT_TWAP_SECONDS)).thenReturn(new BigInteger("950000000000000000"));

        assertThat(oracle.isPtToken(PT)).isTrue();
        assertThat(oracle.priceOf(PT)).isEqualTo(BigInteger.valueOf(95_000_000));
        // 1000 PT (6 decimals) at $0.95
        assertThat(oracle.valueOf(PT, BigInteger.valueOf(1_000_000_000))).isEqualTo(BigInteger.valueOf(95_000_000_000L));
    }

    @Test
    void ptToken_canUseSyRate() {
        oracle.addPtToken(PT, MARKET, true, USDC);
        feed(USDC_FEED, "100000000", 8, NOW);
        when(pendle.ptToSyRate(MARKET, FeedPriceOracle.DEFAULT_TWAP_SECONDS)).thenReturn(new BigInteger("900000000000000000"));

        assertThat(oracle.priceOf(PT)).isEqualTo(BigInteger.valueOf(90_000_000));
        verify(pendle, never()).ptToAssetRate(MARKET, FeedPriceOracle.DEFAULT_TWAP_SECONDS);
    }

    @Test
    void addPtToken_validatesConfiguration() {
        assertThatThrownBy(() -> oracle.addPtToken(PT, null, false, USDC))
                .extracting("code").isEqualTo(OracleException.INVALID_MARKET);
        assertThatThrownBy(() -> oracle.addPtToken(PT, MARKET, false, null))
                .extracting("code").isEqualTo(OracleException.INVALID_UNDERLYING);
        assertThatThrownBy(() -> oracle.addPtToken(PT, MARKET, false, "0x00000000000000000000000000000000000000f1"))
                .extracting("code").isEqualTo(OracleException.UNDERLYING_MISSING_PRICE_FEED);
        // WETH has 18 decimals, the PT 6
        assertThatThrownBy(() -> oracle.addPtToken(PT, MARKET, false, WETH))
                .extracting("code").isEqualTo(OracleException.DECIMALS_MISMATCH);
        assertThat(oracle.isPtToken(PT)).isFalse();
    }

    @Test
    void addPriceFeed_rejectsZeroFeed() {
        assertThatThrownBy(() -> oracle.addPriceFeed(WETH, "0x0000000000000000000000000000000000000000"))
                .extracting("code").isEqualTo(OracleException.INVALID_PRICE_FEED);
    }

    private void feed(String feed, String answer, int decimals, Instant updatedAt) {
        when(feeds.latestRoundData(feed)).thenReturn(round(answer, updatedAt));
        when(feeds.decimals(feed)).thenReturn(decimals);
    }

    private static RoundData round(String answer, Instant updatedAt) {
        BigInteger ts = BigInteger.valueOf(updatedAt.getEpochSecond());
        return new RoundData(BigInteger.ONE, new BigInteger(answer), ts, ts, BigInteger.ONE);
    }
}
