package com.levstrat.service;

import com.levstrat.exception.OracleException;
import com.levstrat.model.ValuationSnapshot;
import com.levstrat.repo.ValuationSnapshotRepo;
import com.levstrat.strategy.LeveragedStrategy;
import com.levstrat.strategy.Valuation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private LeveragedStrategy strategy;
    @Mock
    private ValuationSnapshotRepo repo;

    private ValuationSnapshotService service;

    @BeforeEach
    void setUp() {
        service = new ValuationSnapshotService(strategy, repo, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void capture_savesCurrentValuation() {
        when(strategy.valuation()).thenReturn(new Valuation(
                BigInteger.valueOf(100), BigInteger.valueOf(3000), BigInteger.valueOf(2000),
                BigInteger.valueOf(1100), BigInteger.valueOf(200_000_000L), BigInteger.valueOf(550)));
        when(strategy.address()).thenReturn("0xs");
        when(strategy.baseAsset()).thenReturn("0xb");
        when(repo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ValuationSnapshot snapshot = service.capture();

        assertThat(snapshot.getStrategy()).isEqualTo("0xs");
        assertThat(snapshot.getBaseAsset()).isEqualTo("0xb");
        assertThat(snapshot.getTs()).isEqualTo(NOW);
        assertThat(snapshot.getTotalAssets()).isEqualTo("550");
        assertThat(snapshot.getNetUsd()).isEqualTo("1100");
        assertThat(snapshot.getBaseAssetPrice()).isEqualTo("200000000");
    }

    @Test
    void capture_oracleFailureSavesNothing() {
        when(strategy.valuation()).thenThrow(new OracleException(OracleException.PRICE_DATA_TOO_OLD, "stale"));

        assertThatThrownBy(() -> service.capture()).isInstanceOf(OracleException.class);
        verify(repo, never()).save(any());
    }
}
