package com.levstrat.ledger;

/** State that can be captured and restored so a failed call leaves no trace. */
public interface Journaled {

    Savepoint savepoint();
}
