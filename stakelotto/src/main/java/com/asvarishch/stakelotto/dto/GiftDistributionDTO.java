package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder
public record GiftDistributionDTO(
        Long roundId,
        String creator,
        BigDecimal creatorAmount,
        List<String> recipients,
        BigDecimal userAmount,
        BigDecimal totalPaid,
        BigDecimal remainingReserve
) {
}
