package com.levstrat.schedule;

import com.levstrat.exception.StrategyException;
import com.levstrat.service.ValuationSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Records the strategy valuation on {@code app.valuation.cron}. A failed run (stale price,
 * RPC outage) is logged and retried on the next tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValuationScheduler {

    private final ValuationSnapshotService service;

    @Scheduled(cron = "${app.valuation.cron:0 0/10 * * * ?}")
    public void run() {
        log.info("[valuation-scheduler] started {}", System.currentTimeMillis());
        try {
            service.capture();
        } catch (StrategyException e) {
            log.warn("[valuation-scheduler] skipped: {} {}", e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[valuation-scheduler] failed: {}", e.getMessage(), e);
        }
    }
}
