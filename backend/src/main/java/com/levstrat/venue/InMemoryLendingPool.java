package com.levstrat.venue;

import com.levstrat.exception.ExternalCallException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.Journaled;
import com.levstrat.ledger.Savepoint;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Journaled sandbox lending pool. Holds supplied tokens and lends out of its own ledger
 * balance; there is no interest accrual and no health-factor enforcement.
 */
@Slf4j
public class InMemoryLendingPool implements LendingPool, Journaled {

    private record Key(String account, String asset) {}

    private final String address;
    private final TokenLedger ledger;
    private Map<Key, BigInteger> collateral = new HashMap<>();
    private Map<Key, BigInteger> debt = new HashMap<>();

    public InMemoryLendingPool(String address, TokenLedger ledger) {
        this.address = AddressUtil.normalize(address);
        this.ledger = ledger;
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public synchronized void supply(String account, String asset, BigInteger amount) {
        Key k = key(account, asset, amount);
        ledger.transferFrom(k.asset(), address, k.account(), address, amount);
        collateral.merge(k, amount, BigInteger::add);
        log.debug("[pool] supply {} {} for {}", amount, k.asset(), k.account());
    }

    @Override
    public synchronized BigInteger withdraw(String account, String asset, BigInteger amount) {
        Key k = key(account, asset, amount);
        BigInteger have = collateral.getOrDefault(k, BigInteger.ZERO);
        if (have.compareTo(amount) < 0) {
            throw new ExternalCallException(ExternalCallException.VENUE_CALL_FAILED,
                    "withdraw " + amount + " exceeds collateral " + have + " of " + k.account());
        }
        put(collateral, k, have.subtract(amount));
        ledger.transfer(k.asset(), address, k.account(), amount);
        log.debug("[pool] withdraw {} {} to {}", amount, k.asset(), k.account());
        return amount;
    }

    @Override
    public synchronized void borrow(String account, String asset, BigInteger amount) {
        Key k = key(account, asset, amount);
        BigInteger liquidity = ledger.balanceOf(k.asset(), address);
        if (liquidity.compareTo(amount) < 0) {
            throw new ExternalCallException(ExternalCallException.VENUE_CALL_FAILED,
                    "borrow " + amount + " exceeds pool liquidity " + liquidity);
        }
        debt.merge(k, amount, BigInteger::add);
        ledger.transfer(k.asset(), address, k.account(), amount);
        log.debug("[pool] borrow {} {} by {}", amount, k.asset(), k.account());
    }

    @Override
    public synchronized BigInteger repay(String account, String asset, BigInteger amount) {
        Key k = key(account, asset, amount);
        BigInteger owed = debt.getOrDefault(k, BigInteger.ZERO);
        BigInteger paid = amount.min(owed);
        if (paid.signum() == 0) return BigInteger.ZERO;
        ledger.transferFrom(k.asset(), address, k.account(), address, paid);
        put(debt, k, owed.subtract(paid));
        log.debug("[pool] repay {} {} by {}", paid, k.asset(), k.account());
        return paid;
    }

    @Override
    public synchronized BigInteger collateralBalance(String account, String asset) {
        return collateral.getOrDefault(new Key(AddressUtil.normalize(account), AddressUtil.normalize(asset)), BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger debtBalance(String account, String asset) {
        return debt.getOrDefault(new Key(AddressUtil.normalize(account), AddressUtil.normalize(asset)), BigInteger.ZERO);
    }

    @Override
    public synchronized Savepoint savepoint() {
        final Map<Key, BigInteger> collateralCopy = new HashMap<>(collateral);
        final Map<Key, BigInteger> debtCopy = new HashMap<>(debt);
        return () -> {
            synchronized (InMemoryLendingPool.this) {
                collateral = collateralCopy;
                debt = debtCopy;
            }
        };
    }

    private static Key key(String account, String asset, BigInteger amount) {
        if (AddressUtil.isZero(asset)) throw ValidationException.invalidToken(asset);
        if (amount == null || amount.signum() <= 0) throw ValidationException.invalidAmount("pool amount must be positive: " + amount);
        return new Key(AddressUtil.normalize(account), AddressUtil.normalize(asset));
    }

    private static void put(Map<Key, BigInteger> m, Key k, BigInteger v) {
        if (v.signum() == 0) m.remove(k);
        else m.put(k, v);
    }
}
