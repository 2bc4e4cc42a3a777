package com.asvarishch.stakelotto.dto;

import java.math.BigDecimal;

public record ClaimableWinningsDTO(
        Long roundId,
        String address,
        BigDecimal amount
) {}
