package com.asvarishch.stakelotto.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record GiftPaymentDTO(
        long roundId,
        String recipient,
        BigDecimal amount,
        boolean creatorShare,
        Instant paidAt
) {
}
