package com.levstrat.event;

@FunctionalInterface
public interface StrategyEventSink {

    void emit(StrategyEvent event);
}
