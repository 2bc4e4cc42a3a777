package com.asvarishch.stakelotto.dto;

import com.asvarishch.stakelotto.enums.TimelockParameter;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record ScheduledOperationDTO(
        String operationId,
        TimelockParameter parameter,
        BigDecimal value,
        String scheduledBy,
        Instant executeTime
) {
}
