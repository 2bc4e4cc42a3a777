package com.asvarishch.stakelotto.strategy.impl;

import com.asvarishch.stakelotto.strategy.WinningNumberStrategy;
import com.asvarishch.stakelotto.util.Hashing;
import com.asvarishch.stakelotto.util.LotteryNumbers;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * number_i = value_i mod 49 + 1. On collision with an earlier pick the value is replaced by
 * SHA-256(value || nonce) and reduced again until it lands on a fresh number. Sorted at the end.
 */
@Component
public class ModuloRehashWinningNumberStrategy implements WinningNumberStrategy {

    private static final BigInteger RANGE = BigInteger.valueOf(LotteryNumbers.MAX);

    @Override
    public List<Integer> draw(List<BigInteger> randomValues) {
        Objects.requireNonNull(randomValues, "randomValues must not be null");
        if (randomValues.size() < LotteryNumbers.COUNT) {
            throw new IllegalArgumentException("Need " + LotteryNumbers.COUNT + " random values, got " + randomValues.size());
        }

        final Set<Integer> picked = new LinkedHashSet<>();
        for (int i = 0; i < LotteryNumbers.COUNT; i++) {
            BigInteger value = Objects.requireNonNull(randomValues.get(i), "random value must not be null");
            int candidate = reduce(value);
            long nonce = 0;
            while (picked.contains(candidate)) {
                nonce++;
                value = new BigInteger(1, Hashing.sha256(value.toByteArray(), Hashing.bytes(nonce)));
                candidate = reduce(value);
            }
            picked.add(candidate);
        }

        final List<Integer> numbers = new ArrayList<>(picked);
        numbers.sort(null);
        return LotteryNumbers.requireValid(numbers);
    }

    private static int reduce(BigInteger value) {
        return value.mod(RANGE).intValue() + LotteryNumbers.MIN;
    }
}
