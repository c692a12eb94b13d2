package com.levstrat.api;

import com.levstrat.api.dto.DepositRequest;
import com.levstrat.api.dto.RebalanceRequest;
import com.levstrat.api.dto.StrategyView;
import com.levstrat.api.dto.WithdrawRequest;
import com.levstrat.api.dto.WithdrawResponse;
import com.levstrat.command.CommandCodec;
import com.levstrat.model.StrategyEventDocument;
import com.levstrat.model.ValuationSnapshot;
import com.levstrat.repo.StrategyEventRepo;
import com.levstrat.repo.ValuationSnapshotRepo;
import com.levstrat.sandbox.SandboxParent;
import com.levstrat.service.ValuationSnapshotService;
import com.levstrat.strategy.DepositParams;
import com.levstrat.strategy.LeveragedStrategy;
import com.levstrat.strategy.RebalanceParams;
import com.levstrat.strategy.Valuation;
import com.levstrat.strategy.WithdrawParams;
import com.levstrat.venue.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Strategy surface. Mutations go through the sandbox parent; {@code X-Caller} is the account
 * the strategy sees as the caller, so anything but the parent address is rejected.
 */
@RestController
@RequestMapping("/api/v1/strategy")
@RequiredArgsConstructor
public class StrategyController {

    private static final String CALLER = "X-Caller";

    private final LeveragedStrategy strategy;
    private final SandboxParent parent;
    private final CommandCodec codec;
    private final StrategyEventRepo eventRepo;
    private final ValuationSnapshotRepo valuationRepo;
    private final ValuationSnapshotService valuationService;

    @GetMapping
    public StrategyView view() {
        Position position = strategy.position();
        Valuation valuation = strategy.valuation();
        return StrategyView.builder()
                .address(strategy.address())
                .parent(strategy.parent())
                .venue(strategy.adapter().name())
                .baseAsset(strategy.baseAsset())
                .oracle(strategy.oracle().name())
                .trackedTokens(strategy.trackedTokens())
                .collateral(position.collateral())
                .debt(position.debt())
                .totalAssets(valuation.totalAssets())
                .netUsd(valuation.netUsd())
                .build();
    }

    @GetMapping("/total-assets")
    public BigInteger totalAssets() {
        return strategy.totalAssets();
    }

    @PostMapping("/deposit")
    public void deposit(@RequestHeader(CALLER) String caller, @Validated @RequestBody DepositRequest req) {
        parent.deposit(caller, new DepositParams(
                req.getDepositToken(),
                req.getDepositAmount(),
                req.getFlashLoanToken(),
                req.getProvidedAmount(),
                req.getExpectedAmount(),
                codec.decode(req.getCommands())));
    }

    @PostMapping("/withdraw")
    public WithdrawResponse withdraw(@RequestHeader(CALLER) String caller, @Validated @RequestBody WithdrawRequest req) {
        BigInteger actual = parent.withdraw(caller, new WithdrawParams(
                req.getPercentage(),
                req.getOutputToken(),
                req.getFlashLoanToken(),
                req.getProvidedAmount(),
                req.getExpectedAmount(),
                codec.decode(req.getCommands())));
        return new WithdrawResponse(req.getOutputToken().toLowerCase(), actual);
    }

    @PostMapping("/rebalance")
    public void rebalance(@RequestHeader(CALLER) String caller, @Validated @RequestBody RebalanceRequest req) {
        parent.rebalance(caller, new RebalanceParams(
                req.getFlashLoanToken(),
                req.getProvidedAmount(),
                req.getExpectedAmount(),
                codec.decode(req.getCommands())));
    }

    /** Latest events, newest first; optionally filtered by event name. */
    @GetMapping("/events")
    public List<StrategyEventDocument> events(@RequestParam(required = false) String type) {
        if (type == null || type.isBlank()) {
            return eventRepo.findTop100ByStrategyOrderByTsDesc(strategy.address());
        }
        return eventRepo.findTop100ByStrategyAndTypeOrderByTsDesc(strategy.address(), type);
    }

    /** Valuation history in an inclusive time range. ISO-8601 instants. */
    @GetMapping("/valuations")
    public List<ValuationSnapshot> valuations(@RequestParam Instant from, @RequestParam Instant to) {
        return valuationRepo.findByStrategyAndTsBetweenOrderByTsAsc(strategy.address(), from, to);
    }

    @PostMapping("/valuations/capture")
    public ValuationSnapshot capture() {
        return valuationService.capture();
    }
}
