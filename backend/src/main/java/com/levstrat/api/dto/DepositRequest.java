package com.levstrat.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

/**
 * Deposit made by the sandbox parent. Amounts are in token base units;
 * {@code commands} is the 0x-hex ABI encoding of {@code tuple(uint8,bytes)[]}.
 */
@Data
public class DepositRequest {
    @NotBlank
    private String depositToken;
    @PositiveOrZero
    private BigInteger depositAmount = BigInteger.ZERO;

    /** Optional; zero address or empty when the plan needs no advance. */
    private String flashLoanToken;
    @PositiveOrZero
    private BigInteger providedAmount = BigInteger.ZERO;
    @PositiveOrZero
    private BigInteger expectedAmount = BigInteger.ZERO;

    private String commands;
}
