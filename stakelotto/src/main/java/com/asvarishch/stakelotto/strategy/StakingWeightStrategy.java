package com.asvarishch.stakelotto.strategy;

import java.math.BigDecimal;
import java.time.Instant;

public interface StakingWeightStrategy {

    /**
     * @param stakedAmount     currently staked amount
     * @param stakingStartedAt last time the account staked, null if never
     * @param now              evaluation time
     */
    BigDecimal computeWeight(BigDecimal stakedAmount, Instant stakingStartedAt, Instant now);
}
