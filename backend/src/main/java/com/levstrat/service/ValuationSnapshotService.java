package com.levstrat.service;

import com.levstrat.model.ValuationSnapshot;
import com.levstrat.repo.ValuationSnapshotRepo;
import com.levstrat.strategy.LeveragedStrategy;
import com.levstrat.strategy.Valuation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class ValuationSnapshotService {

    private final LeveragedStrategy strategy;
    private final ValuationSnapshotRepo repo;
    private final Clock clock;

    public ValuationSnapshot capture() {
        Valuation v = strategy.valuation();
        ValuationSnapshot snapshot = ValuationSnapshot.builder()
                .strategy(strategy.address())
                .ts(Instant.now(clock))
                .baseAsset(strategy.baseAsset())
                .totalAssets(v.totalAssets().toString())
                .idleUsd(v.idleUsd().toString())
                .collateralUsd(v.collateralUsd().toString())
                .debtUsd(v.debtUsd().toString())
                .netUsd(v.netUsd().toString())
                .baseAssetPrice(v.baseAssetPrice().toString())
                .build();
        log.info("[valuation] {} totalAssets={} netUsd={}", strategy.address(), v.totalAssets(), v.netUsd());
        return repo.save(snapshot);
    }
}
