package com.asvarishch.stakelotto.strategy.impl;

import com.asvarishch.stakelotto.strategy.EntropySource;
import com.asvarishch.stakelotto.util.Hashing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Execution timestamp + round id; public and predictable, like a block timestamp. */
@Component
@RequiredArgsConstructor
public class ClockEntropySource implements EntropySource {

    private final Clock clock;

    @Override
    public byte[] entropyFor(long roundId) {
        return Hashing.sha256(Hashing.bytes(clock.millis()), Hashing.bytes(roundId));
    }
}
