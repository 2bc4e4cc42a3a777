package com.asvarishch.stakelotto.strategy.impl;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.strategy.StakingWeightStrategy;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-boosted weight (linear interpolation):
 *   - duration <= boostStart (7d)          : weight = stake
 *   - boostStart < duration < boostFull    : weight = stake * (1 + (duration - boostStart) / (boostFull - boostStart))
 *   - duration >= boostFull (30d)          : weight = 2 * stake
 * Non-decreasing in duration for a fixed stake. Interpolation works on whole seconds.
 */
@Component
@RequiredArgsConstructor
public class TimeBoostedStakingWeightStrategy implements StakingWeightStrategy {

    private final LotteryProperties properties;

    @Override
    public BigDecimal computeWeight(BigDecimal stakedAmount, Instant stakingStartedAt, Instant now) {
        if (TokenMath.isZero(stakedAmount)) {
            return TokenMath.ZERO;
        }
        if (stakingStartedAt == null || now == null || !now.isAfter(stakingStartedAt)) {
            return stakedAmount;
        }

        final long elapsed = Duration.between(stakingStartedAt, now).getSeconds();
        final long from = properties.getToken().getBoostStart().getSeconds();
        final long to = properties.getToken().getBoostFull().getSeconds();

        if (elapsed <= from) {
            return stakedAmount;
        }
        // Degenerate window => straight to the full boost
        if (to <= from || elapsed >= to) {
            return TokenMath.mulDiv(stakedAmount, 2, 1);
        }

        final long range = to - from;
        final long position = elapsed - from;
        return TokenMath.mulDiv(stakedAmount, range + position, range);
    }
}
