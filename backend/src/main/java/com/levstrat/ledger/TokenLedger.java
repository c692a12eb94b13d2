package com.levstrat.ledger;

import java.math.BigInteger;

/**
 * Fungible-token port (ERC-20 semantics). The {@code owner}/{@code from}/{@code spender}
 * argument plays the role of the calling account; value only moves out of an account by
 * its own transfer or through an allowance it granted.
 */
public interface TokenLedger extends TokenMetadata {

    BigInteger balanceOf(String token, String holder);

    BigInteger allowance(String token, String owner, String spender);

    /** Sets (overwrites) the allowance of {@code spender} over {@code owner}'s tokens. */
    void approve(String token, String owner, String spender, BigInteger amount);

    void transfer(String token, String from, String to, BigInteger amount);

    /** Moves tokens on behalf of {@code from}, consuming {@code spender}'s allowance. */
    void transferFrom(String token, String spender, String from, String to, BigInteger amount);
}
