package com.levstrat.sandbox;

import com.levstrat.exception.ExternalCallException;
import com.levstrat.ledger.AtomicExecutor;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.strategy.DepositParams;
import com.levstrat.strategy.LeveragedStrategy;
import com.levstrat.strategy.RebalanceParams;
import com.levstrat.strategy.WithdrawParams;
import com.levstrat.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Plays the parent vault in the sandbox: funds the strategy before each call, collects the
 * approved amounts afterwards, and refuses nested calls while one is in flight.
 *
 * <p>The parent account's own ledger balance supplies both the deposit and the
 * {@code providedAmount}; there is no flash-loan provider.
 */
@Slf4j
public class SandboxParent {

    private final LeveragedStrategy strategy;
    private final TokenLedger ledger;
    private final AtomicExecutor atomic;
    private boolean entered;

    public SandboxParent(LeveragedStrategy strategy, TokenLedger ledger, AtomicExecutor atomic) {
        this.strategy = strategy;
        this.ledger = ledger;
        this.atomic = atomic;
    }

    public String address() {
        return strategy.parent();
    }

    public void deposit(String caller, DepositParams params) {
        guarded("deposit", () -> {
            fund(params.depositToken(), params.depositAmount());
            fund(params.flashLoanToken(), params.providedAmount());
            strategy.deposit(caller, params);
            collect(params.flashLoanToken(), params.expectedAmount());
            return null;
        });
    }

    /** @return amount of the output token received, flash-loan repayment excluded */
    public BigInteger withdraw(String caller, WithdrawParams params) {
        return guarded("withdraw", () -> {
            fund(params.flashLoanToken(), params.providedAmount());
            BigInteger actual = strategy.withdraw(caller, params);
            if (AddressUtil.same(params.outputToken(), params.flashLoanToken())) {
                collect(params.outputToken(), actual.add(params.expectedAmount()));
            } else {
                collect(params.outputToken(), actual);
                collect(params.flashLoanToken(), params.expectedAmount());
            }
            return actual;
        });
    }

    public void rebalance(String caller, RebalanceParams params) {
        guarded("rebalance", () -> {
            fund(params.flashLoanToken(), params.providedAmount());
            strategy.rebalance(caller, params);
            collect(params.flashLoanToken(), params.expectedAmount());
            return null;
        });
    }

    private <T> T guarded(String label, Supplier<T> body) {
        return atomic.execute("parent." + label, () -> {
            if (entered) {
                throw new ExternalCallException(ExternalCallException.REENTRANT_CALL, "parent is already executing a call");
            }
            entered = true;
            log.debug("[parent] {} started", label);
            try {
                return body.get();
            } finally {
                entered = false;
            }
        });
    }

    private void fund(String token, BigInteger amount) {
        if (AddressUtil.isZero(token) || amount.signum() <= 0) return;
        ledger.transfer(token, strategy.parent(), strategy.address(), amount);
    }

    private void collect(String token, BigInteger amount) {
        if (AddressUtil.isZero(token) || amount.signum() <= 0) return;
        ledger.transferFrom(token, strategy.parent(), strategy.address(), strategy.parent(), amount);
    }
}
