package com.levstrat.event;

public record OracleUpdated(String strategy, String previousOracle, String newOracle) implements StrategyEvent {
}
