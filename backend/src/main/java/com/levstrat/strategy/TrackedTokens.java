package com.levstrat.strategy;

import com.levstrat.util.AddressUtil;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated, insertion-ordered set of tokens whose idle balances the withdrawal guard
 * protects. Tokens outside this set are not protected.
 */
public final class TrackedTokens {

    private final List<String> tokens;

    private TrackedTokens(Collection<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static TrackedTokens of(String baseAsset, String collateralAsset, String debtAsset, Collection<String> extra) {
        Set<String> set = new LinkedHashSet<>();
        set.add(AddressUtil.normalize(baseAsset));
        set.add(AddressUtil.normalize(collateralAsset));
        set.add(AddressUtil.normalize(debtAsset));
        if (extra != null) {
            for (String t : extra) {
                if (!AddressUtil.isZero(t)) set.add(AddressUtil.normalize(t));
            }
        }
        return new TrackedTokens(set);
    }

    public boolean contains(String token) {
        if (AddressUtil.isZero(token)) return false;
        return tokens.contains(AddressUtil.normalize(token));
    }

    public List<String> asList() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
