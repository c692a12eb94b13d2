package com.levstrat.sandbox;

import com.levstrat.config.AppProps;
import com.levstrat.ledger.InMemoryTokenLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Mints the configured starting balances (parent funds, router inventory, pool liquidity). */
@Component
@RequiredArgsConstructor
@Slf4j
public class SandboxSeeder implements ApplicationRunner {

    private final AppProps props;
    private final InMemoryTokenLedger ledger;

    @Override
    public void run(ApplicationArguments args) {
        for (AppProps.Seed seed : props.getSandbox().getSeed()) {
            ledger.mint(seed.getToken(), seed.getHolder(), seed.getAmount());
            log.info("[sandbox] seeded {} {} to {}", seed.getAmount(), seed.getToken(), seed.getHolder());
        }
    }
}
