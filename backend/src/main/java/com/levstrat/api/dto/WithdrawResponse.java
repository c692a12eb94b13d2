package com.levstrat.api.dto;

import java.math.BigInteger;

public record WithdrawResponse(String outputToken, BigInteger actualWithdrawn) {
}
