package com.levstrat.api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
public class RebalanceRequest {
    private String flashLoanToken;
    @PositiveOrZero
    private BigInteger providedAmount = BigInteger.ZERO;
    @PositiveOrZero
    private BigInteger expectedAmount = BigInteger.ZERO;

    private String commands;
}
