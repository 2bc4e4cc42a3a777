package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.enums.DrawSource;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.enums.RoundPhase;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.Bet;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.BetRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.strategy.WinningNumberStrategy;
import com.asvarishch.stakelotto.util.LotteryNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Settles rounds. Two entry paths end in the same {@link #finalizeDraw}:
 * <ul>
 *   <li>oracle delivery, via {@link RandomnessGateway} (already guarded)</li>
 *   <li>operator emergency draw once the grace window after round end has passed</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawService implements RandomnessConsumer {

    private final RoundRegistry roundRegistry;
    private final RoundRepository roundRepository;
    private final BetRepository betRepository;
    private final WinningNumberStrategy winningNumberStrategy;
    private final AccessControlService accessControl;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    /**
     * Stale deliveries (round gone, already drawn, or superseded request) are consumed
     * upstream and ignored here.
     */
    @Override
    @Transactional
    public void onRandomnessFulfilled(long requestId, long roundId, List<BigInteger> values) {
        final Round round = roundRepository.findById(roundId).orElse(null);
        if (round == null) {
            log.warn("[DRAW] Ignoring randomness requestId={}: round={} not found", requestId, roundId);
            return;
        }
        if (round.isDrawn()) {
            log.warn("[DRAW] Ignoring randomness requestId={}: round={} already drawn by {}",
                    requestId, roundId, round.getDrawSource());
            return;
        }
        if (!Objects.equals(round.getPendingRandomnessRequestId(), requestId)) {
            log.warn("[DRAW] Ignoring randomness requestId={}: round={} awaits requestId={}",
                    requestId, roundId, round.getPendingRandomnessRequestId());
            return;
        }

        final List<Integer> winning = winningNumberStrategy.draw(values);
        finalizeDraw(round, winning, DrawSource.ORACLE, clock.instant());
    }

    /**
     * Operator fallback for an oracle that never answers.
     * <ol>
     *   <li>Caller must hold OPERATOR.</li>
     *   <li>Numbers must pass the same rule as bets.</li>
     *   <li>Round must exist, not be drawn, and {@code now >= end_time + grace}.</li>
     * </ol>
     * An outstanding oracle request is left as is; its late delivery is ignored.
     */
    @Transactional
    public Round emergencyDraw(String operator, long roundId, List<Integer> numbers) {
        return callGuard.call("emergencyDraw", () -> {
            accessControl.requireRole(operator, Role.OPERATOR);
            final List<Integer> winning = LotteryNumbers.requireValid(numbers);

            final Round round = roundRegistry.requireRound(roundId);
            if (round.isDrawn()) {
                throw LotteryException.roundAlreadyDrawn(roundId);
            }
            final Instant now = clock.instant();
            final Instant allowedFrom = round.getEndTime().plus(properties.getRounds().getEmergencyDrawGrace());
            if (now.isBefore(allowedFrom)) {
                throw LotteryException.emergencyDrawTooEarly(roundId, allowedFrom.toString());
            }

            log.warn("[DRAW] Emergency draw round={} by operator={}, pendingRequestId={}",
                    roundId, operator, round.getPendingRandomnessRequestId());
            return finalizeDraw(round, winning, DrawSource.EMERGENCY, now);
        });
    }

    /** Marks the round drawn, scores every bet and opens the next round if this one is current. */
    private Round finalizeDraw(Round round, List<Integer> winning, DrawSource source, Instant now) {
        round.setWinningNumbers(winning);
        round.setStatus(RoundPhase.DRAWN);
        round.setDrawSource(source);
        round.setDrawnAt(now);
        roundRepository.save(round);

        final List<Bet> bets = betRepository.findByRoundIdOrderByBetIndexAsc(round.getRoundId());
        for (Bet bet : bets) {
            bet.setMatchCount(LotteryNumbers.countMatches(bet.getNumbers(), winning));
        }
        betRepository.saveAll(bets);

        log.info("[DRAW] Round={} drawn source={}, winningNumbers={}, bets={}",
                round.getRoundId(), source, winning, bets.size());

        roundRegistry.openNextRoundIfCurrent(round.getRoundId(), now);
        return round;
    }
}
