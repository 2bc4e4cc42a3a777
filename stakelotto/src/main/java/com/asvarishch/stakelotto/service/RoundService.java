package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.ClaimResultDTO;
import com.asvarishch.stakelotto.enums.RoundPhase;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.Bet;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.BetRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.util.Addresses;
import com.asvarishch.stakelotto.util.LotteryNumbers;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Round lifecycle entry points: betting, ending a round and claiming winnings.
 * Settlement itself lives in {@link DrawService}.
 * <p>
 * Phases: {@code OPEN -> CLOSED (derived from end time) -> AWAITING_DRAW -> DRAWN}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {

    private static final int MIN_WINNING_MATCHES = 2;

    private final RoundRegistry roundRegistry;
    private final RoundRepository roundRepository;
    private final BetRepository betRepository;
    private final ParticipationService participationService;
    private final TokenLedgerService tokenLedger;
    private final RandomnessGateway randomnessGateway;
    private final PayoutCalculator payoutCalculator;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    /** Creates the engine state and opens round 1 when no round exists yet. */
    @Transactional
    public Round initialize() {
        roundRegistry.initializeState();
        final long current = roundRegistry.currentRoundId();
        if (current > 0) {
            return roundRegistry.requireRound(current);
        }
        return roundRegistry.openRound(1L, clock.instant());
    }

    /**
     * Places a bet on the current round.
     * <ol>
     *   <li>Engine not paused.</li>
     *   <li>Validate input: address, numbers (5 distinct ascending in [1,49]), amount >= MIN_BET.</li>
     *   <li>Round must be OPEN at {@code now}.</li>
     *   <li>Per-user-per-round cap and staking-weight eligibility.</li>
     *   <li>Collect the wager into the engine account.</li>
     *   <li>Append the bet, update round totals, participants and statistics.</li>
     * </ol>
     */
    @Transactional
    public Bet placeBet(String bettor, List<Integer> numbers, BigDecimal amount) {
        return callGuard.call("placeBet", () -> {
            if (roundRegistry.isPaused()) {
                throw LotteryException.enginePaused();
            }

            // --- 1) Input validation ---
            Addresses.require(bettor);
            final List<Integer> picked = LotteryNumbers.requireValid(numbers);
            if (amount == null || amount.signum() == 0) {
                throw LotteryException.zeroAmount();
            }
            final BigDecimal value = TokenMath.normalize(amount);
            final BigDecimal minBet = properties.getRounds().getMinBet();
            if (value.compareTo(minBet) < 0) {
                throw LotteryException.belowMinBet(value, minBet);
            }

            // --- 2) Phase ---
            final Instant now = clock.instant();
            final Round round = roundRegistry.currentRound();
            final RoundPhase phase = round.phaseAt(now);
            if (phase != RoundPhase.OPEN) {
                throw LotteryException.roundNotOpen(round.getRoundId(), phase);
            }

            // --- 3) Capacity and eligibility ---
            final BigDecimal wagered = TokenMath.add(participationService.wageredInRound(round.getRoundId(), bettor), value);
            final BigDecimal maxBet = properties.getRounds().getMaxBetPerUserPerRound();
            if (wagered.compareTo(maxBet) > 0) {
                throw LotteryException.exceedsMaxBet(wagered, maxBet);
            }
            final BigDecimal weight = tokenLedger.stakingWeight(bettor);
            final BigDecimal minStake = properties.getToken().getMinStake();
            if (weight.compareTo(minStake) < 0) {
                throw LotteryException.notEligible(bettor, weight, minStake);
            }

            // --- 4) Collect wager ---
            tokenLedger.transferInternal(bettor, properties.getAccounts().getEngine(), value);

            // --- 5) Record ---
            final Bet bet = betRepository.save(Bet.builder()
                    .roundId(round.getRoundId())
                    .betIndex(round.getBetCount())
                    .bettor(bettor)
                    .numbers(new ArrayList<>(picked))
                    .amount(value)
                    .placedAt(now)
                    .build());
            round.setBetCount(round.getBetCount() + 1);
            round.setTotalBetAmount(TokenMath.add(round.getTotalBetAmount(), value));
            round.setTotalPrizePool(TokenMath.add(round.getTotalPrizePool(), payoutCalculator.afterHouseEdge(value)));
            roundRepository.save(round);
            participationService.recordParticipation(round.getRoundId(), bettor, value);

            log.info("[BET] Placed round={}, index={}, bettor={}, numbers={}, amount={}",
                    round.getRoundId(), bet.getBetIndex(), bettor, picked, value);

            if (round.hasEnded(clock.instant())) {
                requestDraw(round);
            }
            return bet;
        });
    }

    /**
     * Anyone may end the current round once its end time has passed. Requests five random
     * values and moves the round to AWAITING_DRAW.
     *
     * @return the randomness request id
     */
    @Transactional
    public long endRound() {
        return callGuard.call("endRound", () -> {
            final Round round = roundRegistry.currentRound();
            if (round.isDrawn()) {
                throw LotteryException.roundAlreadyDrawn(round.getRoundId());
            }
            if (round.getStatus() == RoundPhase.AWAITING_DRAW) {
                throw LotteryException.drawAlreadyRequested(round.getRoundId(), round.getPendingRandomnessRequestId());
            }
            if (!round.hasEnded(clock.instant())) {
                throw LotteryException.roundNotEnded(round.getRoundId(), round.getEndTime().toString());
            }
            return requestDraw(round);
        });
    }

    /**
     * Claims the caller's winning bets in a drawn round.
     * <ol>
     *   <li>Bets owned by someone else and bets with fewer than two matches are skipped.</li>
     *   <li>An already claimed bet fails the whole call with {@code ALREADY_CLAIMED}.</li>
     *   <li>Nothing to pay fails with {@code NO_WINNINGS}.</li>
     *   <li>Payouts already made in the round plus this claim must stay within the per-round cap;
     *       earlier claimants can therefore succeed where later ones fail.</li>
     * </ol>
     */
    @Transactional
    public ClaimResultDTO claimWinnings(String claimer, long roundId, List<Integer> betIndices) {
        return callGuard.call("claimWinnings", () -> {
            if (roundRegistry.isPaused()) {
                throw LotteryException.enginePaused();
            }
            Addresses.require(claimer);
            final Round round = roundRegistry.requireRound(roundId);
            if (!round.isDrawn()) {
                throw LotteryException.numbersNotDrawn(roundId);
            }

            // --- 1) Select payable bets ---
            final List<Bet> payable = new ArrayList<>();
            final List<Integer> paidIndices = new ArrayList<>();
            final Set<Integer> seen = new HashSet<>();
            BigDecimal total = TokenMath.ZERO;
            for (Integer index : betIndices == null ? List.<Integer>of() : betIndices) {
                if (index == null) {
                    continue;
                }
                final Bet bet = betRepository.findByRoundIdAndBetIndex(roundId, index)
                        .orElseThrow(() -> LotteryException.betNotFound(roundId, index));
                if (!bet.getBettor().equals(claimer)) {
                    continue;
                }
                final BigDecimal payout = payoutCalculator.payoutFor(bet.getAmount(), bet.getMatchCount());
                if (payout.signum() == 0) {
                    continue;
                }
                if (bet.isClaimed() || !seen.add(index)) {
                    throw LotteryException.alreadyClaimed(roundId, index);
                }
                payable.add(bet);
                paidIndices.add(index);
                total = TokenMath.add(total, payout);
            }
            if (total.signum() == 0) {
                throw LotteryException.noWinnings(roundId, claimer);
            }

            // --- 2) Per-round payout cap ---
            final BigDecimal alreadyPaid = paidInRound(roundId);
            final BigDecimal roundTotal = TokenMath.add(alreadyPaid, total);
            final BigDecimal cap = roundRegistry.maxPayoutPerRound();
            if (roundTotal.compareTo(cap) > 0) {
                throw LotteryException.payoutExceedsMaximum(roundId, roundTotal, cap);
            }

            // --- 3) Mark and pay ---
            payable.forEach(bet -> bet.setClaimed(true));
            betRepository.saveAll(payable);
            tokenLedger.transferInternal(properties.getAccounts().getEngine(), claimer, total);
            participationService.recordWinnings(claimer, total);

            log.info("[CLAIM] Paid round={}, claimer={}, bets={}, payout={}, roundPaid={}",
                    roundId, claimer, paidIndices, total, roundTotal);
            return ClaimResultDTO.builder()
                    .roundId(roundId)
                    .claimer(claimer)
                    .paidBetIndices(List.copyOf(paidIndices))
                    .totalPayout(total)
                    .build();
        });
    }

    /** Unclaimed winnings of {@code address} in {@code roundId}; zero until the round is drawn. */
    @Transactional(readOnly = true)
    public BigDecimal getClaimableWinnings(long roundId, String address) {
        final Round round = roundRepository.findById(roundId).orElse(null);
        if (round == null || !round.isDrawn() || address == null) {
            return TokenMath.ZERO;
        }
        BigDecimal total = TokenMath.ZERO;
        for (Bet bet : betRepository.findByRoundIdAndBettorOrderByBetIndexAsc(roundId, address)) {
            if (!bet.isClaimed()) {
                total = TokenMath.add(total, payoutCalculator.payoutFor(bet.getAmount(), bet.getMatchCount()));
            }
        }
        return total;
    }

    private BigDecimal paidInRound(long roundId) {
        BigDecimal paid = TokenMath.ZERO;
        for (Bet bet : betRepository.findClaimedWinningBets(roundId, MIN_WINNING_MATCHES)) {
            paid = TokenMath.add(paid, payoutCalculator.payoutFor(bet.getAmount(), bet.getMatchCount()));
        }
        return paid;
    }

    private long requestDraw(Round round) {
        final long requestId = randomnessGateway.request(round.getRoundId(), properties.getRandomness().getNumValues());
        round.setStatus(RoundPhase.AWAITING_DRAW);
        round.setPendingRandomnessRequestId(requestId);
        round.setRandomnessRequestedAt(clock.instant());
        roundRepository.save(round);
        log.info("[ROUND] Round={} awaiting draw, requestId={}", round.getRoundId(), requestId);
        return requestId;
    }
}
