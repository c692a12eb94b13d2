package com.levstrat.strategy;

import com.levstrat.command.Command;
import com.levstrat.exception.ExternalCallException;
import com.levstrat.swap.SwapExecutor;
import com.levstrat.venue.LendingAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.levstrat.support.StrategyFixture.*;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommandPipelineTest {

    @Mock
    private LendingAdapter adapter;

    @Mock
    private SwapExecutor swaps;

    @InjectMocks
    private CommandPipeline pipeline;

    @Test
    void execute_dispatchesInOrder() {
        Command.Swap swap = swap(DEBT, 10, COLL, 10, 10, 50);

        pipeline.execute(List.of(
                new Command.Supply(COLL, units(1)),
                new Command.Borrow(DEBT, units(2)),
                swap,
                new Command.Repay(DEBT, units(3)),
                new Command.Withdraw(COLL, units(4))));

        InOrder order = inOrder(adapter, swaps);
        order.verify(adapter).supply(COLL, units(1));
        order.verify(adapter).borrow(DEBT, units(2));
        order.verify(swaps).swap(swap);
        order.verify(adapter).repay(DEBT, units(3));
        order.verify(adapter).withdrawFromVenue(COLL, units(4));
        order.verifyNoMoreInteractions();
    }

    @Test
    void execute_stopsAtFirstFailure() {
        doThrow(new ExternalCallException(ExternalCallException.VENUE_CALL_FAILED, "no liquidity"))
                .when(adapter).borrow(DEBT, units(2));

        assertThatThrownBy(() -> pipeline.execute(List.of(
                new Command.Borrow(DEBT, units(2)),
                new Command.Supply(COLL, units(1)))))
                .isInstanceOf(ExternalCallException.class);

        verify(adapter, never()).supply(any(), any());
    }

    @Test
    void execute_emptyPlanDoesNothing() {
        pipeline.execute(List.of());
        pipeline.execute(null);

        verifyNoInteractions(adapter, swaps);
    }
}
