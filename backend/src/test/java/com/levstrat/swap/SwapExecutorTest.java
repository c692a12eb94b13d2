package com.levstrat.swap;

import com.levstrat.command.Command;
import com.levstrat.event.StrategyEvent;
import com.levstrat.event.SwapExecuted;
import com.levstrat.exception.ExternalCallException;
import com.levstrat.exception.SlippageException;
import com.levstrat.exception.ValidationException;
import com.levstrat.ledger.InMemoryTokenLedger;
import com.levstrat.sandbox.QuotedSwapRouter;
import com.levstrat.support.FixedPriceOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwapExecutorTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000005a7e01";
    private static final String ROUTER = "0x0000000000000000000000000000000000005a01";
    private static final String TOKEN_A = "0x000000000000000000000000000000000000000a";
    private static final String TOKEN_B = "0x000000000000000000000000000000000000000b";

    private final InMemoryTokenLedger ledger = new InMemoryTokenLedger();
    private final RouterRegistry routers = new RouterRegistry();
    private final List<StrategyEvent> events = new ArrayList<>();
    private SwapExecutor executor;

    @BeforeEach
    void setUp() {
        ledger.registerToken(TOKEN_A, "A", 0);
        ledger.registerToken(TOKEN_B, "B", 0);
        ledger.mint(TOKEN_A, ACCOUNT, BigInteger.valueOf(1000));
        ledger.mint(TOKEN_B, ROUTER, BigInteger.valueOf(5000));
        routers.register(0, new QuotedSwapRouter(ROUTER, ledger));
        FixedPriceOracle oracle = new FixedPriceOracle(ledger).price(TOKEN_A, 1).price(TOKEN_B, 1);
        executor = new SwapExecutor(ACCOUNT, ledger, routers, () -> oracle, events::add);
    }

    @Test
    void swap_lossAboveOracleToleranceReverts() {
        // $1000 in, $994 out: 0.6% loss against a 0.5% tolerance
        assertThatThrownBy(() -> executor.swap(swap(1000, 994, 0, 50)))
                .isInstanceOfSatisfying(SlippageException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(SlippageException.ORACLE_SLIPPAGE_CHECK_FAILED);
                    assertThat(e.getActual()).isEqualTo(new BigInteger("99400000000"));
                    assertThat(e.getMinimum()).isEqualTo(new BigInteger("99500000000"));
                });
    }

    @Test
    void swap_lossWithinOracleToleranceSucceeds() {
        BigInteger out = executor.swap(swap(1000, 994, 0, 100));

        assertThat(out).isEqualTo(BigInteger.valueOf(994));
        assertThat(ledger.balanceOf(TOKEN_B, ACCOUNT)).isEqualTo(BigInteger.valueOf(994));
        assertThat(ledger.balanceOf(TOKEN_A, ACCOUNT)).isZero();
        assertThat(ledger.allowance(TOKEN_A, ACCOUNT, ROUTER)).isZero();

        SwapExecuted e = (SwapExecuted) events.get(0);
        assertThat(e.usdValueIn()).isEqualTo(new BigInteger("100000000000"));
        assertThat(e.usdValueOut()).isEqualTo(new BigInteger("99400000000"));
        assertThat(e.amountOut()).isEqualTo(BigInteger.valueOf(994));
        assertThat(e.router()).isEqualTo(ROUTER);
    }

    @Test
    void swap_outputBelowMinimumReverts() {
        assertThatThrownBy(() -> executor.swap(swap(1000, 994, 995, 10_000)))
                .isInstanceOf(SlippageException.class)
                .extracting("code").isEqualTo(SlippageException.SLIPPAGE_TOO_HIGH);
    }

    @Test
    void swap_routerFailureIsWrappedAndApprovalCleared() {
        routers.register(1, new SwapRouter() {
            @Override
            public String address() {
                return ROUTER;
            }

            @Override
            public void execute(String caller, byte[] payload) {
                throw new IllegalStateException("pool paused");
            }
        });

        assertThatThrownBy(() -> executor.swap(new Command.Swap(1, TOKEN_A, BigInteger.TEN, TOKEN_B, BigInteger.ZERO, 100, new byte[0])))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("pool paused")
                .extracting("code").isEqualTo(ExternalCallException.SWAP_FAILED);
        assertThat(ledger.allowance(TOKEN_A, ACCOUNT, ROUTER)).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void swap_routerCannotPullMoreThanAmountIn() {
        // payload asks for 1000 while the command only approves 10
        Command.Swap greedy = new Command.Swap(0, TOKEN_A, BigInteger.TEN, TOKEN_B, BigInteger.ZERO, 10_000,
                QuotedSwapRouter.quote(TOKEN_A, BigInteger.valueOf(1000), TOKEN_B, BigInteger.TEN));

        assertThatThrownBy(() -> executor.swap(greedy))
                .isInstanceOf(ExternalCallException.class)
                .extracting("code").isEqualTo(ExternalCallException.SWAP_FAILED);
        assertThat(ledger.balanceOf(TOKEN_A, ACCOUNT)).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    void swap_rejectsUnknownRouter() {
        assertThatThrownBy(() -> executor.swap(new Command.Swap(7, TOKEN_A, BigInteger.TEN, TOKEN_B, BigInteger.ZERO, 100, new byte[0])))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ValidationException.INVALID_ROUTER);
    }

    @Test
    void swap_rejectsBadArguments() {
        assertThatThrownBy(() -> executor.swap(new Command.Swap(0, null, BigInteger.TEN, TOKEN_B, BigInteger.ZERO, 100, new byte[0])))
                .extracting("code").isEqualTo(ValidationException.INVALID_TOKEN);
        assertThatThrownBy(() -> executor.swap(new Command.Swap(0, TOKEN_A, BigInteger.ZERO, TOKEN_B, BigInteger.ZERO, 100, new byte[0])))
                .extracting("code").isEqualTo(ValidationException.INVALID_AMOUNT);
        assertThatThrownBy(() -> executor.swap(new Command.Swap(0, TOKEN_A, BigInteger.TEN, TOKEN_B, BigInteger.ZERO, 10_001, new byte[0])))
                .extracting("code").isEqualTo(ValidationException.INVALID_AMOUNT);
    }

    @Test
    void registry_rejectsOutOfRangeIds() {
        assertThatThrownBy(() -> routers.register(256, new QuotedSwapRouter(ROUTER, ledger)))
                .isInstanceOf(ValidationException.class);
        assertThat(routers.ids()).containsExactly(0);
    }

    private static Command.Swap swap(long in, long out, long minOut, int bps) {
        return new Command.Swap(0, TOKEN_A, BigInteger.valueOf(in), TOKEN_B, BigInteger.valueOf(minOut), bps,
                QuotedSwapRouter.quote(TOKEN_A, BigInteger.valueOf(in), TOKEN_B, BigInteger.valueOf(out)));
    }
}
