package com.levstrat.oracle;

import com.levstrat.exception.OracleException;
import com.levstrat.exception.StrategyException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.TokenMetadata;
import com.levstrat.util.AddressUtil;
import com.levstrat.util.FixedPoint;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prices tokens from aggregator feeds, and Pendle PT tokens as
 * {@code underlying price x PT rate}.
 *
 * Rules:
 *  - answer must be positive, and updated within {@code maxStaleness} of now;
 *  - feed answers are rescaled to 8 decimals whatever the feed's own decimals;
 *  - a PT token must share its underlying's decimals and the underlying must have a feed.
 */
@Slf4j
public class FeedPriceOracle implements PriceOracle {

    public static final Duration DEFAULT_MAX_STALENESS = Duration.ofHours(24);
    public static final int DEFAULT_TWAP_SECONDS = 900;

    /** PT token registration. */
    public record PtToken(String market, boolean useSyRate, String underlying) {}

    private final PriceFeedReader feedReader;
    private final PendleRateReader pendleReader;
    private final TokenMetadata tokens;
    private final Clock clock;
    private final Duration maxStaleness;
    private final int twapSeconds;

    private final Map<String, String> feeds = new ConcurrentHashMap<>();
    private final Map<String, PtToken> ptTokens = new ConcurrentHashMap<>();
    private final Map<String, Integer> feedDecimals = new ConcurrentHashMap<>();

    public FeedPriceOracle(PriceFeedReader feedReader,
                           PendleRateReader pendleReader,
                           TokenMetadata tokens,
                           Clock clock,
                           Duration maxStaleness,
                           int twapSeconds) {
        this.feedReader = feedReader;
        this.pendleReader = pendleReader;
        this.tokens = tokens;
        this.clock = clock;
        this.maxStaleness = maxStaleness == null ? DEFAULT_MAX_STALENESS : maxStaleness;
        this.twapSeconds = twapSeconds > 0 ? twapSeconds : DEFAULT_TWAP_SECONDS;
    }

    // ---------------------------- Registration ----------------------------

    public void addPriceFeed(String token, String feed) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        if (AddressUtil.isZero(feed)) throw new OracleException(OracleException.INVALID_PRICE_FEED, "invalid price feed for " + token);
        String t = AddressUtil.normalize(token);
        String f = AddressUtil.normalize(feed);
        String previous = feeds.put(t, f);
        log.info("[oracle] price feed for {} set to {} (was {})", t, f, previous);
    }

    public void addPtToken(String ptToken, String market, boolean useSyRate, String underlying) {
        if (AddressUtil.isZero(ptToken)) throw ValidationException.invalidToken(ptToken);
        if (AddressUtil.isZero(market)) throw new OracleException(OracleException.INVALID_MARKET, "invalid market for " + ptToken);
        if (AddressUtil.isZero(underlying)) throw new OracleException(OracleException.INVALID_UNDERLYING, "invalid underlying for " + ptToken);

        String pt = AddressUtil.normalize(ptToken);
        String u = AddressUtil.normalize(underlying);
        if (!feeds.containsKey(u)) {
            throw new OracleException(OracleException.UNDERLYING_MISSING_PRICE_FEED, "underlying " + u + " has no price feed");
        }
        int ptDecimals = tokens.decimals(pt);
        int underlyingDecimals = tokens.decimals(u);
        if (ptDecimals != underlyingDecimals) {
            throw new OracleException(OracleException.DECIMALS_MISMATCH,
                    "PT " + pt + " has " + ptDecimals + " decimals, underlying " + u + " has " + underlyingDecimals);
        }
        ptTokens.put(pt, new PtToken(AddressUtil.normalize(market), useSyRate, u));
        log.info("[oracle] PT token {} registered (market={}, useSy={}, underlying={})", pt, market, useSyRate, u);
    }

    public Optional<String> priceFeed(String token) {
        if (AddressUtil.isZero(token)) return Optional.empty();
        return Optional.ofNullable(feeds.get(AddressUtil.normalize(token)));
    }

    public Optional<PtToken> ptToken(String token) {
        if (AddressUtil.isZero(token)) return Optional.empty();
        return Optional.ofNullable(ptTokens.get(AddressUtil.normalize(token)));
    }

    public boolean isPtToken(String token) {
        return ptToken(token).isPresent();
    }

    // ---------------------------- PriceOracle ----------------------------

    @Override
    public BigInteger valueOf(String token, BigInteger amount) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        if (amount == null || amount.signum() == 0) return BigInteger.ZERO;
        String t = AddressUtil.normalize(token);
        BigInteger price = priceOf(t);
        return FixedPoint.mulDiv(amount, price, FixedPoint.pow10(tokens.decimals(t)));
    }

    @Override
    public BigInteger priceOf(String token) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        String t = AddressUtil.normalize(token);

        PtToken pt = ptTokens.get(t);
        if (pt != null) {
            BigInteger underlyingPrice = feedPrice(pt.underlying());
            BigInteger rate = ptRate(pt);
            return FixedPoint.mulDiv(underlyingPrice, rate, FixedPoint.PERCENTAGE_DENOMINATOR);
        }
        return feedPrice(t);
    }

    // ---------------------------- Internals ----------------------------

    private BigInteger feedPrice(String token) {
        String feed = feeds.get(token);
        if (feed == null) throw new OracleException(OracleException.PRICE_FEED_NOT_FOUND, "no price feed for " + token);

        RoundData round;
        int decimals;
        try {
            round = feedReader.latestRoundData(feed);
            decimals = feedDecimals.computeIfAbsent(feed, feedReader::decimals);
        } catch (StrategyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleException(OracleException.ORACLE_UNAVAILABLE, "feed " + feed + " unreadable: " + e.getMessage(), e);
        }

        if (round.answer() == null || round.answer().signum() <= 0) {
            throw new OracleException(OracleException.INVALID_PRICE, "non-positive answer " + round.answer() + " from feed " + feed);
        }
        long updatedAt = updatedAtSeconds(feed, round.updatedAt());
        long now = clock.instant().getEpochSecond();
        if (updatedAt == 0L || now - updatedAt > maxStaleness.getSeconds()) {
            throw new OracleException(OracleException.PRICE_DATA_TOO_OLD,
                    "feed " + feed + " last updated at " + updatedAt + ", now " + now);
        }
        return FixedPoint.rescale(round.answer(), decimals, FixedPoint.USD_DECIMALS);
    }

    private static long updatedAtSeconds(String feed, BigInteger updatedAt) {
        if (updatedAt == null) return 0L;
        if (updatedAt.signum() < 0 || updatedAt.bitLength() > 63) {
            throw new OracleException(OracleException.INVALID_PRICE, "malformed timestamp " + updatedAt + " from feed " + feed);
        }
        return updatedAt.longValue();
    }

    private BigInteger ptRate(PtToken pt) {
        BigInteger rate;
        try {
            rate = pt.useSyRate()
                    ? pendleReader.ptToSyRate(pt.market(), twapSeconds)
                    : pendleReader.ptToAssetRate(pt.market(), twapSeconds);
        } catch (StrategyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleException(OracleException.ORACLE_UNAVAILABLE, "PT rate for market " + pt.market() + " unreadable: " + e.getMessage(), e);
        }
        if (rate == null || rate.signum() <= 0) {
            throw new OracleException(OracleException.INVALID_PRICE, "non-positive PT rate " + rate + " for market " + pt.market());
        }
        return rate;
    }
}
