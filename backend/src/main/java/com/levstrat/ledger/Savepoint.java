package com.levstrat.ledger;

/** Captured state of one {@link Journaled} resource. */
public interface Savepoint {

    /** Restores the resource to the captured state. */
    void rollback();

    /** Called when the enclosing call completed successfully. */
    default void release() {
    }
}
