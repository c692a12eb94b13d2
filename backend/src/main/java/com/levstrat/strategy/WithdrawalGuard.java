package com.levstrat.strategy;

import com.levstrat.command.Command;
import com.levstrat.event.StrategyEventSink;
import com.levstrat.event.Withdrawn;
import com.levstrat.exception.ProportionalityException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.TokenLedger;
import com.levstrat.util.AddressUtil;
import com.levstrat.util.FixedPoint;
import com.levstrat.venue.LendingAdapter;
import com.levstrat.venue.Position;
import com.levstrat.venue.UnwindPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * Partial withdrawal for a keeper-supplied percentage.
 *
 * <p>The venue unwind is computed here, not by the keeper. The keeper's commands may only swap
 * between tracked tokens, the flash-loan token and the output token. After everything ran, every
 * tracked token other than the output token must keep at least {@code (1 - p)} of its snapshot
 * balance (plus the flash-loan repayment for the flash-loan token), so a keeper cannot extract
 * more than the requested share of idle funds.
 */
@Slf4j
@RequiredArgsConstructor
public class WithdrawalGuard {

    private final String account;
    private final String parent;
    private final TokenLedger ledger;
    private final LendingAdapter adapter;
    private final TrackedTokens tracked;
    private final CommandPipeline pipeline;
    private final StrategyEventSink events;

    public BigInteger withdraw(WithdrawParams params) {
        BigInteger p = params.percentage();
        if (p == null || p.signum() <= 0 || p.compareTo(FixedPoint.PERCENTAGE_DENOMINATOR) > 0) {
            throw new ValidationException(ValidationException.INVALID_PERCENTAGE, "percentage out of range: " + p);
        }
        if (AddressUtil.isZero(params.outputToken())) {
            throw ValidationException.invalidToken(params.outputToken());
        }
        String output = AddressUtil.normalize(params.outputToken());
        String flash = AddressUtil.normalizeOrZero(params.flashLoanToken());
        boolean hasFlash = !AddressUtil.isZero(flash);
        BigInteger provided = params.providedAmount();
        BigInteger expected = params.expectedAmount();
        if (!hasFlash && (provided.signum() != 0 || expected.signum() != 0)) {
            throw ValidationException.invalidAmount("flash-loan amounts given without a flash-loan token");
        }
        if (provided.signum() < 0 || expected.signum() < 0) {
            throw ValidationException.invalidAmount("negative flash-loan amount");
        }

        BalanceSnapshot snapshot = BalanceSnapshot.capture(ledger, account, tracked, hasFlash ? flash : null, provided);

        if (!tracked.contains(output)) throw ValidationException.invalidToken(output);
        if (hasFlash && !tracked.contains(flash)) throw ValidationException.invalidToken(flash);

        unwind(p);

        List<Command> commands = params.commands();
        for (Command c : commands) requireKeeperSwap(c, output, flash);
        pipeline.execute(commands);

        requireProportional(snapshot, p, output, flash, expected);

        BigInteger current = ledger.balanceOf(output, account);
        BigInteger gained = current.subtract(snapshot.balanceOf(output));
        boolean outputIsFlash = hasFlash && output.equals(flash);
        BigInteger actual = FixedPoint.subFloor(gained, outputIsFlash ? expected : BigInteger.ZERO);

        if (outputIsFlash) {
            ledger.approve(output, account, parent, actual.add(expected));
        } else {
            ledger.approve(output, account, parent, actual);
            if (hasFlash) ledger.approve(flash, account, parent, expected);
        }

        log.info("[withdraw] p={} output={} actual={} flash={} provided={} expected={}", p, output, actual, flash, provided, expected);
        events.emit(new Withdrawn(account, p, output, actual, flash, provided, expected));
        return actual;
    }

    private void unwind(BigInteger percentage) {
        Position position = adapter.positionAmounts();
        UnwindPlan plan = adapter.planUnwind(position, percentage);
        log.debug("[withdraw] position={} plan={}", position, plan);
        if (plan.repayAmount().signum() > 0) adapter.repay(adapter.debtAsset(), plan.repayAmount());
        if (plan.withdrawAmount().signum() > 0) adapter.withdrawFromVenue(adapter.collateralAsset(), plan.withdrawAmount());
    }

    private void requireKeeperSwap(Command c, String output, String flash) {
        if (!(c instanceof Command.Swap s)) {
            throw new ValidationException(ValidationException.INVALID_KEEPER_COMMAND,
                    "only swaps are allowed during withdrawal, got " + (c == null ? null : c.type()));
        }
        requireSwappable(s.tokenIn(), output, flash);
        requireSwappable(s.tokenOut(), output, flash);
    }

    private void requireSwappable(String token, String output, String flash) {
        if (AddressUtil.isZero(token)) throw ValidationException.invalidToken(token);
        String t = AddressUtil.normalize(token);
        if (tracked.contains(t) || t.equals(output) || t.equals(flash)) return;
        throw ValidationException.invalidToken(t);
    }

    private void requireProportional(BalanceSnapshot snapshot, BigInteger p, String output, String flash, BigInteger expected) {
        BigInteger keep = FixedPoint.PERCENTAGE_DENOMINATOR.subtract(p);
        for (String token : tracked.asList()) {
            if (token.equals(output)) continue;
            BigInteger required = FixedPoint.mulDiv(snapshot.balanceOf(token), keep, FixedPoint.PERCENTAGE_DENOMINATOR);
            if (token.equals(flash)) required = required.add(expected);
            BigInteger current = ledger.balanceOf(token, account);
            if (current.compareTo(required) < 0) {
                log.warn("[withdraw] {} balance {} below required {}", token, current, required);
                throw new ProportionalityException(token, current, required);
            }
        }
    }
}
