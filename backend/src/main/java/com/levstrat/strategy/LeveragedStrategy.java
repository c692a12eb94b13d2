package com.levstrat.strategy;

import com.levstrat.event.Deposited;
import com.levstrat.event.OracleUpdated;
import com.levstrat.event.Rebalanced;
import com.levstrat.event.StrategyEventSink;
import com.levstrat.exception.UnauthorizedException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.AtomicExecutor;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.oracle.PriceOracle;
import com.levstrat.swap.RouterRegistry;
import com.levstrat.swap.SwapExecutor;
import com.levstrat.util.AddressUtil;
import com.levstrat.venue.LendingAdapter;
import com.levstrat.venue.Position;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Leveraged position held on one lending venue, driven by a single parent account.
 *
 * <p>Every mutating entry point runs all-or-nothing through the {@link AtomicExecutor}: a
 * failure anywhere (including in a swap router or the venue) restores the ledger, the venue
 * and the pending events to their state before the call.
 *
 * <p>There is no reentrancy guard here. The parent is expected to hold a lock across each call
 * it makes, so a router that calls back into the parent fails there. Direct calls from anyone
 * other than the parent are rejected with {@link UnauthorizedException}.
 */
@Slf4j
public class LeveragedStrategy {

    private final String address;
    private final String parent;
    private final String baseAsset;
    private final TokenLedger ledger;
    private final LendingAdapter adapter;
    private final StrategyEventSink events;
    private final AtomicExecutor atomic;
    private final TrackedTokens tracked;
    private final CommandPipeline pipeline;
    private final WithdrawalGuard withdrawals;
    private final ValuationService valuation;

    private volatile PriceOracle oracle;

    @Builder
    public LeveragedStrategy(String address,
                             String parent,
                             String baseAsset,
                             PriceOracle oracle,
                             TokenLedger ledger,
                             LendingAdapter adapter,
                             RouterRegistry routers,
                             StrategyEventSink events,
                             AtomicExecutor atomic,
                             List<String> extraTrackedTokens) {
        if (AddressUtil.isZero(address)) throw ValidationException.invalidToken(address);
        if (AddressUtil.isZero(parent)) throw ValidationException.invalidToken(parent);
        if (AddressUtil.isZero(baseAsset)) throw ValidationException.invalidToken(baseAsset);
        if (oracle == null) throw new ValidationException(ValidationException.ZERO_ADDRESS, "oracle is not set");
        if (ledger == null || adapter == null || routers == null || events == null || atomic == null) {
            throw new IllegalArgumentException("ledger, adapter, routers, events and atomic are required");
        }
        this.address = AddressUtil.normalize(address);
        this.parent = AddressUtil.normalize(parent);
        this.baseAsset = AddressUtil.normalize(baseAsset);
        this.oracle = oracle;
        this.ledger = ledger;
        this.adapter = adapter;
        this.events = events;
        this.atomic = atomic;

        List<String> extra = new ArrayList<>(adapter.extraTrackedTokens());
        if (extraTrackedTokens != null) extra.addAll(extraTrackedTokens);
        this.tracked = TrackedTokens.of(this.baseAsset, adapter.collateralAsset(), adapter.debtAsset(), extra);

        SwapExecutor swaps = new SwapExecutor(this.address, ledger, routers, this::oracle, events);
        this.pipeline = new CommandPipeline(adapter, swaps);
        this.withdrawals = new WithdrawalGuard(this.address, this.parent, ledger, adapter, tracked, pipeline, events);
        this.valuation = new ValuationService(this.address, this.baseAsset, ledger, adapter, tracked, this::oracle);
        log.info("[strategy] {} on {} parent={} tracked={}", this.address, adapter.name(), this.parent, tracked);
    }

    /**
     * Runs the operator plan after the parent moved {@code depositAmount} (and any flash-loaned
     * {@code providedAmount}) into the strategy, then approves {@code expectedAmount} of the
     * flash-loan token for the parent to collect.
     */
    public void deposit(String caller, DepositParams params) {
        requireParent(caller);
        atomic.run("deposit", () -> {
            String flash = requireTrackedFlashToken(params.flashLoanToken());
            pipeline.execute(params.commands());
            approveFlashLoanReturn(flash, params.expectedAmount());
            log.info("[deposit] token={} amount={} commands={}", params.depositToken(), params.depositAmount(), params.commands().size());
            events.emit(new Deposited(address, AddressUtil.normalizeOrZero(params.depositToken()), params.depositAmount(),
                    flash, params.providedAmount(), params.expectedAmount(), params.commands().size()));
        });
    }

    /**
     * Withdraws {@code percentage} of the position into {@code outputToken}.
     *
     * @return amount of {@code outputToken} approved for the parent, excluding the flash-loan repayment
     */
    public BigInteger withdraw(String caller, WithdrawParams params) {
        requireParent(caller);
        return atomic.execute("withdraw", () -> withdrawals.withdraw(params));
    }

    public void rebalance(String caller, RebalanceParams params) {
        requireParent(caller);
        atomic.run("rebalance", () -> {
            String flash = requireTrackedFlashToken(params.flashLoanToken());
            pipeline.execute(params.commands());
            approveFlashLoanReturn(flash, params.expectedAmount());
            log.info("[rebalance] commands={}", params.commands().size());
            events.emit(new Rebalanced(address, flash, params.providedAmount(), params.expectedAmount(), params.commands().size()));
        });
    }

    public void setOracle(String caller, PriceOracle newOracle) {
        requireParent(caller);
        if (newOracle == null) throw new ValidationException(ValidationException.ZERO_ADDRESS, "oracle is not set");
        atomic.run("setOracle", () -> {
            PriceOracle previous = oracle;
            oracle = newOracle;
            log.info("[strategy] oracle {} -> {}", previous.name(), newOracle.name());
            events.emit(new OracleUpdated(address, previous.name(), newOracle.name()));
        });
    }

    public BigInteger totalAssets() {
        return atomic.read(valuation::totalAssets);
    }

    public Valuation valuation() {
        return atomic.read(valuation::valuation);
    }

    public Position position() {
        return atomic.read(adapter::positionAmounts);
    }

    public String address() {
        return address;
    }

    public String parent() {
        return parent;
    }

    public String baseAsset() {
        return baseAsset;
    }

    public PriceOracle oracle() {
        return oracle;
    }

    public LendingAdapter adapter() {
        return adapter;
    }

    public List<String> trackedTokens() {
        return tracked.asList();
    }

    private void requireParent(String caller) {
        if (!AddressUtil.same(caller, parent)) throw new UnauthorizedException(caller);
    }

    private String requireTrackedFlashToken(String token) {
        if (AddressUtil.isZero(token)) return AddressUtil.ZERO;
        if (!tracked.contains(token)) throw ValidationException.invalidToken(token);
        return AddressUtil.normalize(token);
    }

    private void approveFlashLoanReturn(String flash, BigInteger expected) {
        if (expected.signum() <= 0) return;
        if (AddressUtil.isZero(flash)) {
            throw ValidationException.invalidAmount("expected amount given without a flash-loan token");
        }
        ledger.approve(flash, address, parent, expected);
    }
}
