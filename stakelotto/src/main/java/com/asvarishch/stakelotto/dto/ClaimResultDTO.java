package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder
public record ClaimResultDTO(
        Long roundId,
        String claimer,
        List<Integer> paidBetIndices,
        BigDecimal totalPayout
) {
}
