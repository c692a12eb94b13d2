package com.levstrat.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of one committed strategy event. Amounts are stored as decimal strings
 * to keep full uint256 precision.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("strategy_events")
public class StrategyEventDocument {

    @Id
    private String id;

    @Indexed
    private String strategy;

    /** Event name, e.g. "SwapExecuted". */
    @Indexed
    private String type;

    @Indexed
    private Instant ts;

    private Map<String, String> payload;
}
