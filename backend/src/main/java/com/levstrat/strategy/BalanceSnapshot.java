package com.levstrat.strategy;

import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.util.AddressUtil;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Idle balances of the tracked tokens at the start of a withdrawal. Funds the parent
 * advanced for the call ({@code providedAmount} of the flash-loan token) are excluded.
 */
public final class BalanceSnapshot {

    private final Map<String, BigInteger> balances;

    private BalanceSnapshot(Map<String, BigInteger> balances) {
        this.balances = balances;
    }

    public static BalanceSnapshot capture(TokenLedger ledger, String account, TrackedTokens tracked,
                                          String flashLoanToken, BigInteger providedAmount) {
        Map<String, BigInteger> out = new LinkedHashMap<>();
        for (String token : tracked.asList()) {
            BigInteger balance = ledger.balanceOf(token, account);
            if (AddressUtil.same(token, flashLoanToken)) {
                if (balance.compareTo(providedAmount) < 0) {
                    throw ValidationException.invalidAmount("provided amount " + providedAmount
                            + " exceeds balance " + balance + " of flash-loan token " + token);
                }
                balance = balance.subtract(providedAmount);
            }
            out.put(token, balance);
        }
        return new BalanceSnapshot(out);
    }

    /** Zero for tokens outside the snapshot. */
    public BigInteger balanceOf(String token) {
        if (AddressUtil.isZero(token)) return BigInteger.ZERO;
        return balances.getOrDefault(AddressUtil.normalize(token), BigInteger.ZERO);
    }

    public Map<String, BigInteger> asMap() {
        return Map.copyOf(balances);
    }
}
