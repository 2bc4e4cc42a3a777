package com.asvarishch.stakelotto.util;

import com.asvarishch.stakelotto.exception.LotteryException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The single numbers rule shared by betting, emergency draws and oracle draws:
 * exactly five integers in [1, 49], strictly ascending (which also excludes duplicates).
 * Unsorted input is rejected, never normalised.
 */
public final class LotteryNumbers {

    public static final int COUNT = 5;
    public static final int MIN = 1;
    public static final int MAX = 49;

    private LotteryNumbers() {
    }

    public static List<Integer> requireValid(List<Integer> numbers) {
        if (numbers == null) {
            throw LotteryException.invalidNumbers(null, "numbers must not be null");
        }
        if (numbers.size() != COUNT) {
            throw LotteryException.invalidNumbers(numbers, "expected " + COUNT + " numbers");
        }
        Integer previous = null;
        for (Integer n : numbers) {
            if (n == null) {
                throw LotteryException.invalidNumbers(numbers, "null entry");
            }
            if (n < MIN || n > MAX) {
                throw LotteryException.invalidNumbers(numbers, n + " is outside [" + MIN + "," + MAX + "]");
            }
            if (previous != null && n.equals(previous)) {
                throw LotteryException.invalidNumbers(numbers, "duplicate " + n);
            }
            if (previous != null && n < previous) {
                throw LotteryException.invalidNumbers(numbers, "not in ascending order");
            }
            previous = n;
        }
        return List.copyOf(numbers);
    }

    public static boolean isValid(List<Integer> numbers) {
        try {
            requireValid(numbers);
            return true;
        } catch (LotteryException e) {
            return false;
        }
    }

    /** Size of the intersection of a bet's numbers and the winning numbers. */
    public static int countMatches(Collection<Integer> betNumbers, Collection<Integer> winningNumbers) {
        Objects.requireNonNull(betNumbers, "betNumbers must not be null");
        Objects.requireNonNull(winningNumbers, "winningNumbers must not be null");
        Set<Integer> winning = new HashSet<>(winningNumbers);
        int matches = 0;
        for (Integer n : betNumbers) {
            if (winning.contains(n)) {
                matches++;
            }
        }
        return matches;
    }

    /** Canonical storage form, e.g. "1,5,15,25,35". */
    public static String encode(List<Integer> numbers) {
        if (numbers == null || numbers.isEmpty()) {
            return "";
        }
        return numbers.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    public static List<Integer> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(encoded.split(","))
                .map(String::trim)
                .map(Integer::valueOf)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
