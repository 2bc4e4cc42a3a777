package com.asvarishch.stakelotto.strategy;

import java.math.BigInteger;
import java.util.List;

public interface WinningNumberStrategy {

    /** Derives five distinct, ascending numbers in [1, 49] from oracle values. */
    List<Integer> draw(List<BigInteger> randomValues);
}
