package com.levstrat.strategy;

import com.levstrat.command.Command;
import com.levstrat.exception.ValidationException;
import com.levstrat.swap.SwapExecutor;
import com.levstrat.venue.LendingAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Executes an operator plan in order. A failing command propagates; undoing the earlier
 * commands is the enclosing atomic call's job. There is no retry or skip.
 */
@Slf4j
@RequiredArgsConstructor
public class CommandPipeline {

    private final LendingAdapter adapter;
    private final SwapExecutor swaps;

    public void execute(List<Command> commands) {
        if (commands == null || commands.isEmpty()) return;
        for (int i = 0; i < commands.size(); i++) {
            Command c = commands.get(i);
            log.debug("[pipeline] #{} {}", i, c);
            dispatch(c);
        }
    }

    void dispatch(Command c) {
        if (c instanceof Command.Supply s) {
            adapter.supply(s.asset(), s.amount());
        } else if (c instanceof Command.Withdraw w) {
            adapter.withdrawFromVenue(w.asset(), w.amount());
        } else if (c instanceof Command.Borrow b) {
            adapter.borrow(b.asset(), b.amount());
        } else if (c instanceof Command.Repay r) {
            adapter.repay(r.asset(), r.amount());
        } else if (c instanceof Command.Swap s) {
            swaps.swap(s);
        } else {
            throw new ValidationException(ValidationException.UNKNOWN_COMMAND, "unknown command: " + c);
        }
    }
}
