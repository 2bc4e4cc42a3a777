package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record GiftReserveDTO(
        BigDecimal balance,
        BigDecimal costPerRound,
        BigDecimal creatorAmount,
        BigDecimal userAmount,
        int recipientsPerRound,
        BigDecimal totalDistributed
) {
}
