package com.asvarishch.stakelotto.strategy;

/** Environment-supplied entropy mixed into gift selection. */
public interface EntropySource {

    byte[] entropyFor(long roundId);
}
