package com.levstrat.config;

import com.levstrat.command.CommandCodec;
import com.levstrat.event.TransactionalEventBuffer;
import com.levstrat.ledger.AtomicExecutor;
import com.levstrat.ledger.InMemoryTokenLedger;
import com.levstrat.oracle.FeedPriceOracle;
import com.levstrat.sandbox.QuotedSwapRouter;
import com.levstrat.strategy.LeveragedStrategy;
import com.levstrat.swap.RouterRegistry;
import com.levstrat.venue.AaveLendingAdapter;
import com.levstrat.venue.InMemoryLendingPool;
import com.levstrat.web3.Web3ClientFactory;
import com.levstrat.web3.Web3PendleRateReader;
import com.levstrat.web3.Web3PriceFeedReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires one strategy instance against the sandbox ledger and lending pool,
 * priced by live on-chain feeds.
 */
@Slf4j
@Configuration
public class StrategyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CommandCodec commandCodec() {
        return new CommandCodec();
    }

    @Bean
    public InMemoryTokenLedger tokenLedger(AppProps props) {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        props.getTokens().forEach((address, t) -> ledger.registerToken(address, t.getSymbol(), t.getDecimals()));
        log.info("[sandbox] registered {} tokens", props.getTokens().size());
        return ledger;
    }

    @Bean
    public InMemoryLendingPool lendingPool(AppProps props, InMemoryTokenLedger ledger) {
        return new InMemoryLendingPool(props.getSandbox().getLendingPool(), ledger);
    }

    @Bean
    public TransactionalEventBuffer eventBuffer(ApplicationEventPublisher publisher) {
        return new TransactionalEventBuffer(publisher);
    }

    @Bean
    public AtomicExecutor atomicExecutor(InMemoryTokenLedger ledger, InMemoryLendingPool pool, TransactionalEventBuffer events) {
        return new AtomicExecutor(List.of(ledger, pool, events));
    }

    @Bean
    public Web3ClientFactory web3ClientFactory(AppProps props) {
        return new Web3ClientFactory(props);
    }

    @Bean
    public FeedPriceOracle priceOracle(AppProps props, Web3ClientFactory web3, InMemoryTokenLedger ledger, Clock clock) {
        AppProps.Oracle cfg = props.getOracle();
        FeedPriceOracle oracle = new FeedPriceOracle(
                new Web3PriceFeedReader(web3, cfg.getNetwork()),
                new Web3PendleRateReader(web3, cfg.getNetwork(), cfg.getPendleOracle()),
                ledger,
                clock,
                cfg.getMaxStaleness(),
                cfg.getPendleTwapSeconds());
        cfg.getFeeds().forEach(oracle::addPriceFeed);
        // PT tokens last: their underlying must already have a feed
        cfg.getPtTokens().forEach((pt, m) -> oracle.addPtToken(pt, m.getMarket(), m.isUseSyRate(), m.getUnderlying()));
        return oracle;
    }

    @Bean
    public RouterRegistry routerRegistry(AppProps props, InMemoryTokenLedger ledger) {
        RouterRegistry registry = new RouterRegistry();
        for (AppProps.Router r : props.getSandbox().getRouters()) {
            registry.register(r.getId(), new QuotedSwapRouter(r.getAddress(), ledger));
        }
        return registry;
    }

    @Bean
    public AaveLendingAdapter lendingAdapter(AppProps props, InMemoryLendingPool pool, InMemoryTokenLedger ledger) {
        AppProps.Strategy s = props.getStrategy();
        return new AaveLendingAdapter(pool, ledger, s.getAddress(), s.getCollateralAsset(), s.getDebtAsset(), List.of());
    }

    @Bean
    public LeveragedStrategy leveragedStrategy(AppProps props,
                                               FeedPriceOracle oracle,
                                               InMemoryTokenLedger ledger,
                                               AaveLendingAdapter adapter,
                                               RouterRegistry routers,
                                               TransactionalEventBuffer events,
                                               AtomicExecutor atomic) {
        AppProps.Strategy s = props.getStrategy();
        return LeveragedStrategy.builder()
                .address(s.getAddress())
                .parent(s.getParent())
                .baseAsset(s.getBaseAsset())
                .oracle(oracle)
                .ledger(ledger)
                .adapter(adapter)
                .routers(routers)
                .events(events)
                .atomic(atomic)
                .extraTrackedTokens(s.getExtraTrackedTokens())
                .build();
    }
}
