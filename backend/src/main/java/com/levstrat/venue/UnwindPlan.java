package com.levstrat.venue;

import java.math.BigInteger;

/** Protocol-level deleveraging for a proportional withdrawal: repay first, then withdraw. */
public record UnwindPlan(BigInteger repayAmount, BigInteger withdrawAmount) {
}
