package com.asvarishch.stakelotto.service;

import java.math.BigInteger;
import java.util.List;

/** Receives accepted randomness deliveries, synchronously inside the delivering call. */
public interface RandomnessConsumer {

    void onRandomnessFulfilled(long requestId, long roundId, List<BigInteger> values);
}
