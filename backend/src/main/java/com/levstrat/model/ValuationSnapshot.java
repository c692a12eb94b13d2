package com.levstrat.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Periodic valuation of a strategy. USD figures have 8 decimals, {@code totalAssets} is in
 * base-asset units; all stored as decimal strings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("valuation_snapshots")
public class ValuationSnapshot {

    @Id
    private String id;

    @Indexed
    private String strategy;

    @Indexed
    private Instant ts;

    private String baseAsset;
    private String totalAssets;

    private String idleUsd;
    private String collateralUsd;
    private String debtUsd;
    private String netUsd;
    private String baseAssetPrice;
}
