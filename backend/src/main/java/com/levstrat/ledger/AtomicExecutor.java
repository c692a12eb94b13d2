package com.levstrat.ledger;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs a call all-or-nothing across a fixed set of journaled resources.
 *
 * Calls are serialized (one at a time, like transactions in a block). The lock is reentrant,
 * so a nested call made from inside a running one on the same thread is not blocked here;
 * reentrancy protection is the caller's responsibility.
 */
@Slf4j
public class AtomicExecutor {

    private final List<Journaled> resources;
    private final ReentrantLock lock = new ReentrantLock();

    public AtomicExecutor(List<? extends Journaled> resources) {
        this.resources = List.copyOf(resources);
    }

    public <T> T execute(String label, Supplier<T> body) {
        lock.lock();
        try {
            List<Savepoint> savepoints = new ArrayList<>(resources.size());
            for (Journaled r : resources) savepoints.add(r.savepoint());
            T out;
            try {
                out = body.get();
            } catch (Throwable e) {
                // Errors included; restore in reverse order of capture
                for (int i = savepoints.size() - 1; i >= 0; i--) savepoints.get(i).rollback();
                log.warn("[atomic] {} reverted: {}", label, e.getMessage());
                throw e;
            }
            for (Savepoint sp : savepoints) sp.release();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public void run(String label, Runnable body) {
        execute(label, () -> {
            body.run();
            return null;
        });
    }

    /** Read under the same lock, without savepoints. */
    public <T> T read(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
