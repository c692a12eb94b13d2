package com.levstrat.venue;

import com.levstrat.exception.ExternalCallException;
import com.levstrat.exception.StrategyException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * {@link LendingAdapter} over an Aave-style {@link LendingPool}.
 * Supply and repay grant the pool an exact allowance and clear it afterwards.
 */
@Slf4j
public class AaveLendingAdapter implements LendingAdapter {

    private final LendingPool pool;
    private final TokenLedger ledger;
    private final String account;
    private final String collateralAsset;
    private final String debtAsset;
    private final List<String> extraTrackedTokens;

    public AaveLendingAdapter(LendingPool pool, TokenLedger ledger, String account,
                              String collateralAsset, String debtAsset, List<String> extraTrackedTokens) {
        if (AddressUtil.isZero(collateralAsset)) throw ValidationException.invalidToken(collateralAsset);
        if (AddressUtil.isZero(debtAsset)) throw ValidationException.invalidToken(debtAsset);
        this.pool = pool;
        this.ledger = ledger;
        this.account = AddressUtil.normalize(account);
        this.collateralAsset = AddressUtil.normalize(collateralAsset);
        this.debtAsset = AddressUtil.normalize(debtAsset);
        this.extraTrackedTokens = extraTrackedTokens == null ? List.of()
                : extraTrackedTokens.stream().map(AddressUtil::normalize).toList();
    }

    @Override
    public String name() {
        return "aave";
    }

    @Override
    public String collateralAsset() {
        return collateralAsset;
    }

    @Override
    public String debtAsset() {
        return debtAsset;
    }

    @Override
    public List<String> extraTrackedTokens() {
        return extraTrackedTokens;
    }

    @Override
    public Position positionAmounts() {
        return new Position(
                pool.collateralBalance(account, collateralAsset),
                pool.debtBalance(account, debtAsset));
    }

    @Override
    public void supply(String asset, BigInteger amount) {
        String a = validate(asset, amount);
        venueCall("supply", () -> {
            ledger.approve(a, account, pool.address(), amount);
            try {
                pool.supply(account, a, amount);
            } finally {
                ledger.approve(a, account, pool.address(), BigInteger.ZERO);
            }
        });
    }

    @Override
    public void withdrawFromVenue(String asset, BigInteger amount) {
        String a = validate(asset, amount);
        venueCall("withdraw", () -> pool.withdraw(account, a, amount));
    }

    @Override
    public void borrow(String asset, BigInteger amount) {
        String a = validate(asset, amount);
        venueCall("borrow", () -> pool.borrow(account, a, amount));
    }

    @Override
    public void repay(String asset, BigInteger amount) {
        String a = validate(asset, amount);
        venueCall("repay", () -> {
            ledger.approve(a, account, pool.address(), amount);
            try {
                pool.repay(account, a, amount);
            } finally {
                ledger.approve(a, account, pool.address(), BigInteger.ZERO);
            }
        });
    }

    private static String validate(String asset, BigInteger amount) {
        if (AddressUtil.isZero(asset)) throw ValidationException.invalidToken(asset);
        if (amount == null || amount.signum() <= 0) throw ValidationException.invalidAmount("amount must be positive: " + amount);
        return AddressUtil.normalize(asset);
    }

    private void venueCall(String op, Runnable call) {
        try {
            call.run();
        } catch (StrategyException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalCallException(ExternalCallException.VENUE_CALL_FAILED,
                    "aave " + op + " failed: " + e.getMessage(), e);
        }
        log.debug("[aave] {} ok", op);
    }
}
