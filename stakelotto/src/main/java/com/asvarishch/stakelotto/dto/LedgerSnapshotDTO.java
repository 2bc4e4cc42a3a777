package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record LedgerSnapshotDTO(
        BigDecimal totalSupply,
        BigDecimal totalStaked,
        BigDecimal totalBurned,
        boolean emergencyMode
) {
}
