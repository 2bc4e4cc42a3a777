package com.asvarishch.stakelotto.strategy;

import java.util.List;

public interface RecipientSelectionStrategy {

    /**
     * Picks {@code count} distinct entries of {@code eligible}. Deterministic for equal inputs.
     * Returns all of {@code eligible} when it holds no more than {@code count}.
     */
    List<String> select(List<String> eligible, int count, byte[] seed);
}
