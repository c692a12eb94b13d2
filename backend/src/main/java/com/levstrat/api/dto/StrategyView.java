package com.levstrat.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyView {
    private String address;
    private String parent;
    private String venue;
    private String baseAsset;
    private String oracle;
    private List<String> trackedTokens;

    private BigInteger collateral;
    private BigInteger debt;

    /** Base-asset units. */
    private BigInteger totalAssets;
    /** USD, 8 decimals. */
    private BigInteger netUsd;
}
