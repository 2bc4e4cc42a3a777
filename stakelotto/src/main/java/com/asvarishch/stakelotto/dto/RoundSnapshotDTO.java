package com.asvarishch.stakelotto.dto;

import com.asvarishch.stakelotto.enums.DrawSource;
import com.asvarishch.stakelotto.enums.RoundPhase;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder
public record RoundSnapshotDTO(
        Long roundId,
        RoundPhase phase,
        Instant startTime,
        Instant endTime,
        boolean drawn,
        List<Integer> winningNumbers,
        BigDecimal totalBetAmount,
        BigDecimal totalPrizePool,
        int betCount,
        List<String> participants,
        boolean giftsDistributed,
        Long pendingRandomnessRequestId,
        DrawSource drawSource,
        Instant drawnAt
) {
}
