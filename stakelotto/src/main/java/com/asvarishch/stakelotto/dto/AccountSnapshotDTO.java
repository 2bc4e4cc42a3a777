package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record AccountSnapshotDTO(
        String address,
        BigDecimal balance,
        BigDecimal stakedAmount,
        BigDecimal availableBalance,
        Instant stakingStartedAt,
        BigDecimal stakingWeight,
        boolean eligibleForBenefits,
        BigDecimal totalBets,
        long betCount,
        BigDecimal totalWinnings,
        int consecutiveRounds,
        long lastParticipatedRound,
        long lastGiftRound,
        boolean eligibleForGift
) {
}
