package com.levstrat.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

@Data
public class WithdrawRequest {
    /** Share of the position, 1e18 = 100%. */
    @NotNull
    private BigInteger percentage;
    @NotBlank
    private String outputToken;

    private String flashLoanToken;
    @PositiveOrZero
    private BigInteger providedAmount = BigInteger.ZERO;
    @PositiveOrZero
    private BigInteger expectedAmount = BigInteger.ZERO;

    /** Swap-only clean-up plan, 0x hex. */
    private String commands;
}
