package com.levstrat.event;

import com.levstrat.ledger.Journaled;
import com.levstrat.ledger.Savepoint;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds events emitted inside a call and publishes them when the outermost call commits.
 * A rolled-back call drops everything it emitted.
 */
public class TransactionalEventBuffer implements StrategyEventSink, Journaled {

    private final ApplicationEventPublisher publisher;
    private final List<StrategyEvent> pending = new ArrayList<>();
    private int depth;

    public TransactionalEventBuffer(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public synchronized void emit(StrategyEvent event) {
        if (depth == 0) {
            publisher.publishEvent(event);
            return;
        }
        pending.add(event);
    }

    @Override
    public synchronized Savepoint savepoint() {
        final int mark = pending.size();
        depth++;
        return new Savepoint() {
            @Override
            public void rollback() {
                synchronized (TransactionalEventBuffer.this) {
                    pending.subList(mark, pending.size()).clear();
                    depth--;
                }
            }

            @Override
            public void release() {
                List<StrategyEvent> toPublish = List.of();
                synchronized (TransactionalEventBuffer.this) {
                    depth--;
                    if (depth == 0) {
                        toPublish = new ArrayList<>(pending);
                        pending.clear();
                    }
                }
                for (StrategyEvent e : toPublish) publisher.publishEvent(e);
            }
        };
    }

    synchronized int pendingCount() {
        return pending.size();
    }
}
