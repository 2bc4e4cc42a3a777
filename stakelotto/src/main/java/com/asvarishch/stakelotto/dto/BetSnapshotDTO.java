package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder
public record BetSnapshotDTO(
        Long roundId,
        int betIndex,
        String bettor,
        List<Integer> numbers,
        BigDecimal amount,
        Instant placedAt,
        int matchCount,
        boolean claimed
) {
}
