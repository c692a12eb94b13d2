package com.levstrat.config;

import com.levstrat.ledger.AtomicExecutor;
import com.levstrat.ledger.InMemoryTokenLedger;
import com.levstrat.sandbox.SandboxParent;
import com.levstrat.strategy.LeveragedStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    @Bean
    public SandboxParent sandboxParent(LeveragedStrategy strategy, InMemoryTokenLedger ledger, AtomicExecutor atomic) {
        return new SandboxParent(strategy, ledger, atomic);
    }
}
