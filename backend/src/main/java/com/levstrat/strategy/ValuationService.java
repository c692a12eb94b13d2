package com.levstrat.strategy;

import com.levstrat.exception.OracleException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.oracle.PriceOracle;
import com.levstrat.util.FixedPoint;
import com.levstrat.venue.LendingAdapter;
import com.levstrat.venue.Position;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Net value of the strategy in base-asset units: idle tracked balances plus venue collateral
 * minus venue debt, all priced in USD by the current oracle, floored at zero.
 */
@RequiredArgsConstructor
public class ValuationService {

    private final String account;
    private final String baseAsset;
    private final TokenLedger ledger;
    private final LendingAdapter adapter;
    private final TrackedTokens tracked;
    private final Supplier<PriceOracle> oracle;

    public BigInteger totalAssets() {
        return valuation().totalAssets();
    }

    public Valuation valuation() {
        PriceOracle o = oracle.get();

        BigInteger idle = BigInteger.ZERO;
        for (String token : tracked.asList()) {
            idle = idle.add(usd(o, token, ledger.balanceOf(token, account)));
        }
        Position position = adapter.positionAmounts();
        BigInteger collateral = usd(o, adapter.collateralAsset(), position.collateral());
        BigInteger debt = usd(o, adapter.debtAsset(), position.debt());

        BigInteger gross = idle.add(collateral);
        BigInteger net = FixedPoint.subFloor(gross, debt);

        BigInteger price = o.priceOf(baseAsset);
        if (price.signum() <= 0) {
            throw new OracleException(OracleException.INVALID_CONFIGURATION, "base asset has no usable price: " + baseAsset);
        }
        BigInteger total = net.signum() == 0
                ? BigInteger.ZERO
                : FixedPoint.mulDiv(net, FixedPoint.pow10(ledger.decimals(baseAsset)), price);
        return new Valuation(idle, collateral, debt, net, price, total);
    }

    private static BigInteger usd(PriceOracle o, String token, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) return BigInteger.ZERO;
        return o.valueOf(token, amount);
    }
}
