package com.levstrat.ledger;

import com.levstrat.exception.ExternalCallException;
import com.levstrat.exception.ValidationException;
import com.levstrat.util.AddressUtil;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Journaled in-process token ledger used as the sandbox chain state.
 * Addresses are normalized on entry; unknown tokens are rejected.
 */
public class InMemoryTokenLedger implements TokenLedger, Journaled {

    private record TokenInfo(String symbol, int decimals) {}

    private record AllowanceKey(String token, String owner, String spender) {}

    private final Map<String, TokenInfo> tokens = new HashMap<>();
    private Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private Map<AllowanceKey, BigInteger> allowances = new HashMap<>();

    public synchronized void registerToken(String token, String symbol, int decimals) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        if (decimals < 0 || decimals > 36) throw new IllegalArgumentException("unsupported decimals: " + decimals);
        tokens.put(AddressUtil.normalize(token), new TokenInfo(symbol, decimals));
    }

    public synchronized boolean isRegistered(String token) {
        return !AddressUtil.isZero(token) && tokens.containsKey(AddressUtil.normalize(token));
    }

    /** Credits {@code amount} out of thin air (sandbox funding). */
    public synchronized void mint(String token, String to, BigInteger amount) {
        String t = requireToken(token);
        credit(t, AddressUtil.normalize(to), requireNonNegative(amount));
    }

    /** Removes {@code amount} from {@code from} (sandbox accounting, e.g. lost funds). */
    public synchronized void burn(String token, String from, BigInteger amount) {
        String t = requireToken(token);
        debit(t, AddressUtil.normalize(from), requireNonNegative(amount));
    }

    @Override
    public synchronized int decimals(String token) {
        return tokens.get(requireToken(token)).decimals();
    }

    @Override
    public synchronized String symbol(String token) {
        return tokens.get(requireToken(token)).symbol();
    }

    @Override
    public synchronized BigInteger balanceOf(String token, String holder) {
        Map<String, BigInteger> byHolder = balances.get(requireToken(token));
        if (byHolder == null) return BigInteger.ZERO;
        return byHolder.getOrDefault(AddressUtil.normalize(holder), BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(String token, String owner, String spender) {
        return allowances.getOrDefault(key(requireToken(token), owner, spender), BigInteger.ZERO);
    }

    @Override
    public synchronized void approve(String token, String owner, String spender, BigInteger amount) {
        if (AddressUtil.isZero(spender)) throw new ValidationException(ValidationException.ZERO_ADDRESS, "approve to zero address");
        AllowanceKey k = key(requireToken(token), owner, spender);
        if (requireNonNegative(amount).signum() == 0) allowances.remove(k);
        else allowances.put(k, amount);
    }

    @Override
    public synchronized void transfer(String token, String from, String to, BigInteger amount) {
        String t = requireToken(token);
        if (AddressUtil.isZero(to)) throw new ValidationException(ValidationException.ZERO_ADDRESS, "transfer to zero address");
        requireNonNegative(amount);
        String f = AddressUtil.normalize(from);
        debit(t, f, amount);
        credit(t, AddressUtil.normalize(to), amount);
    }

    @Override
    public synchronized void transferFrom(String token, String spender, String from, String to, BigInteger amount) {
        String t = requireToken(token);
        AllowanceKey k = key(t, from, spender);
        BigInteger allowed = allowances.getOrDefault(k, BigInteger.ZERO);
        if (allowed.compareTo(requireNonNegative(amount)) < 0) {
            throw new ExternalCallException(ExternalCallException.TRANSFER_FAILED,
                    "insufficient allowance of " + t + " for " + spender + ": " + allowed + " < " + amount);
        }
        transfer(t, from, to, amount);
        BigInteger left = allowed.subtract(amount);
        if (left.signum() == 0) allowances.remove(k);
        else allowances.put(k, left);
    }

    @Override
    public synchronized Savepoint savepoint() {
        final Map<String, Map<String, BigInteger>> balanceCopy = deepCopy(balances);
        final Map<AllowanceKey, BigInteger> allowanceCopy = new HashMap<>(allowances);
        return () -> {
            synchronized (InMemoryTokenLedger.this) {
                balances = balanceCopy;
                allowances = allowanceCopy;
            }
        };
    }

    // ---------------------------- Internals ----------------------------

    private void credit(String token, String holder, BigInteger amount) {
        balances.computeIfAbsent(token, k -> new HashMap<>()).merge(holder, amount, BigInteger::add);
    }

    private void debit(String token, String holder, BigInteger amount) {
        Map<String, BigInteger> byHolder = balances.computeIfAbsent(token, k -> new HashMap<>());
        BigInteger have = byHolder.getOrDefault(holder, BigInteger.ZERO);
        if (have.compareTo(amount) < 0) {
            throw new ExternalCallException(ExternalCallException.TRANSFER_FAILED,
                    "insufficient balance of " + token + " for " + holder + ": " + have + " < " + amount);
        }
        byHolder.put(holder, have.subtract(amount));
    }

    private String requireToken(String token) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        String t = AddressUtil.normalize(token);
        if (!tokens.containsKey(t)) throw ValidationException.invalidToken(token);
        return t;
    }

    private static BigInteger requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) throw ValidationException.invalidAmount("negative or missing amount: " + amount);
        return amount;
    }

    private static AllowanceKey key(String token, String owner, String spender) {
        return new AllowanceKey(token, AddressUtil.normalize(owner), AddressUtil.normalize(spender));
    }

    private static Map<String, Map<String, BigInteger>> deepCopy(Map<String, Map<String, BigInteger>> src) {
        Map<String, Map<String, BigInteger>> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, new HashMap<>(v)));
        return out;
    }
}
