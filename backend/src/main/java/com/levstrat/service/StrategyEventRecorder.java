package com.levstrat.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.levstrat.event.StrategyEvent;
import com.levstrat.model.StrategyEventDocument;
import com.levstrat.repo.StrategyEventRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists committed strategy events. Events arrive only after the call that produced them
 * succeeded, so a failed write here cannot undo strategy state; it is logged instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyEventRecorder {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final StrategyEventRepo repo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void onEvent(StrategyEvent event) {
        try {
            repo.save(toDocument(event, Instant.now(clock)));
        } catch (RuntimeException e) {
            log.error("[events] failed to persist {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    StrategyEventDocument toDocument(StrategyEvent event, Instant ts) {
        Map<String, String> payload = new LinkedHashMap<>();
        objectMapper.convertValue(event, FIELDS)
                .forEach((k, v) -> payload.put(k, v == null ? null : String.valueOf(v)));
        return StrategyEventDocument.builder()
                .strategy(event.strategy())
                .type(event.getClass().getSimpleName())
                .ts(ts)
                .payload(payload)
                .build();
    }
}
