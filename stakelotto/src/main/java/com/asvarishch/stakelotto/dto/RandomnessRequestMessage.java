package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.time.Instant;

@Builder
public record RandomnessRequestMessage(
        Long requestId,
        Long roundId,
        int numValues,
        String keyHash,
        long subscriptionId,
        int requestConfirmations,
        long callbackGasLimit,
        Instant requestedAt
) {
}
