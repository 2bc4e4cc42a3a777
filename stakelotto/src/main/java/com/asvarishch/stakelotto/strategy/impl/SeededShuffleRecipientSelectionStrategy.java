package com.asvarishch.stakelotto.strategy.impl;

import com.asvarishch.stakelotto.strategy.RecipientSelectionStrategy;
import com.asvarishch.stakelotto.util.Hashing;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Partial Fisher-Yates shuffle driven by SHA-256(seed || i).
 * <p>
 * Not cryptographically unpredictable: the seed is built from already-published winning
 * numbers, so anyone can precompute the outcome before distribution executes.
 */
@Component
public class SeededShuffleRecipientSelectionStrategy implements RecipientSelectionStrategy {

    @Override
    public List<String> select(List<String> eligible, int count, byte[] seed) {
        Objects.requireNonNull(eligible, "eligible must not be null");
        Objects.requireNonNull(seed, "seed must not be null");
        if (count <= 0) {
            return List.of();
        }
        if (eligible.size() <= count) {
            return List.copyOf(eligible);
        }

        final List<String> pool = new ArrayList<>(eligible);
        final int n = pool.size();
        for (int i = 0; i < count; i++) {
            BigInteger draw = new BigInteger(1, Hashing.sha256(seed, Hashing.bytes(i)));
            int j = i + draw.mod(BigInteger.valueOf(n - i)).intValue();
            Collections.swap(pool, i, j);
        }
        return List.copyOf(pool.subList(0, count));
    }
}
