package com.levstrat.venue;

import com.levstrat.util.FixedPoint;

import java.math.BigInteger;
import java.util.List;

/**
 * Capability interface of one lending venue (Aave, Morpho, Euler, ...). The command pipeline
 * and the withdrawal guard depend only on this interface.
 */
public interface LendingAdapter {

    String name();

    String collateralAsset();

    String debtAsset();

    /** Read live from the venue on every call. */
    Position positionAmounts();

    void supply(String asset, BigInteger amount);

    void withdrawFromVenue(String asset, BigInteger amount);

    void borrow(String asset, BigInteger amount);

    void repay(String asset, BigInteger amount);

    /** Venue-specific tokens (e.g. rewards) whose idle balances must also be protected. */
    default List<String> extraTrackedTokens() {
        return List.of();
    }

    /**
     * Unwind amounts for withdrawing {@code percentage} (1e18 = 100%) of the position.
     * Debt is over-repaid by one unit of the percentage scale, rounded up and capped at the
     * outstanding debt, so the remaining position is never less healthy than before.
     * Venues with their own health-factor math override this.
     */
    default UnwindPlan planUnwind(Position position, BigInteger percentage) {
        BigInteger repay = FixedPoint.mulDivUp(position.debt(), percentage.add(BigInteger.ONE), FixedPoint.PERCENTAGE_DENOMINATOR);
        if (repay.compareTo(position.debt()) > 0) repay = position.debt();
        BigInteger withdraw = FixedPoint.mulDiv(position.collateral(), percentage, FixedPoint.PERCENTAGE_DENOMINATOR);
        return new UnwindPlan(repay, withdraw);
    }
}
