package com.levstrat.event;

/** Audit record emitted by a strategy call; published only once the call has committed. */
public interface StrategyEvent {

    String strategy();
}
