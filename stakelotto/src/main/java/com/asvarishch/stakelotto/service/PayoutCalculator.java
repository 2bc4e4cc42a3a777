package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/** Payout table: amount x multiplier(matches), less the house edge. */
@Component
@RequiredArgsConstructor
public class PayoutCalculator {

    private static final long BPS_DENOMINATOR = 10_000L;

    private final LotteryProperties properties;

    /** Zero for fewer than two matches. */
    public BigDecimal payoutFor(BigDecimal amount, int matchCount) {
        if (!isWinning(matchCount)) {
            return TokenMath.ZERO;
        }
        final long multiplier = properties.getRounds().getPayoutMultipliers().get(matchCount);
        final BigDecimal gross = TokenMath.mulDiv(amount, multiplier, 1);
        return afterHouseEdge(gross);
    }

    public BigDecimal afterHouseEdge(BigDecimal amount) {
        return TokenMath.mulDiv(amount, BPS_DENOMINATOR - properties.getRounds().getHouseEdgeBps(), BPS_DENOMINATOR);
    }

    public boolean isWinning(int matchCount) {
        final Long multiplier = properties.getRounds().getPayoutMultipliers().get(matchCount);
        return multiplier != null && multiplier > 0;
    }
}
