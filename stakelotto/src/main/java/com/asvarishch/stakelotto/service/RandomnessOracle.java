package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.dto.RandomnessRequestMessage;

/**
 * Outbound side of the external randomness source. Fire-and-forget: the answer, if any,
 * comes back later through {@link RandomnessGateway#deliver}.
 */
public interface RandomnessOracle {

    void requestRandomness(RandomnessRequestMessage message);
}
