package com.levstrat.venue;

import java.math.BigInteger;

/**
 * Aave-style pool. {@code account} is the calling account: supply and repay pull tokens
 * from it through the allowance it granted to {@link #address()}.
 */
public interface LendingPool {

    String address();

    void supply(String account, String asset, BigInteger amount);

    /** @return amount withdrawn */
    BigInteger withdraw(String account, String asset, BigInteger amount);

    void borrow(String account, String asset, BigInteger amount);

    /** Repays at most the outstanding debt. @return amount repaid */
    BigInteger repay(String account, String asset, BigInteger amount);

    BigInteger collateralBalance(String account, String asset);

    BigInteger debtBalance(String account, String asset);
}
