package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.model.PlayerStats;
import com.asvarishch.stakelotto.model.RoundParticipant;
import com.asvarishch.stakelotto.repository.PlayerStatsRepository;
import com.asvarishch.stakelotto.repository.RoundParticipantRepository;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Round participant sets and per-address play statistics.
 * <p>
 * Consecutive-play rule, applied on every bet:
 * <ol>
 *   <li>bet in the round already counted: unchanged</li>
 *   <li>previous participation was exactly the preceding round: +1</li>
 *   <li>anything else (first bet ever, or a gap): reset to 1</li>
 * </ol>
 * Gift eligibility is re-derived from the counter, so a reset also clears it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipationService {

    private final RoundParticipantRepository participantRepository;
    private final PlayerStatsRepository playerStatsRepository;
    private final LotteryProperties properties;

    @Transactional
    public PlayerStats recordParticipation(long roundId, String address, BigDecimal amount) {
        // --- 1) Participant set (join order preserved) ---
        final RoundParticipant participant = participantRepository.findByRoundIdAndAddress(roundId, address)
                .orElseGet(() -> RoundParticipant.builder()
                        .roundId(roundId)
                        .address(address)
                        .joinOrder((int) participantRepository.countByRoundId(roundId))
                        .build());
        participant.setTotalBetAmount(TokenMath.add(participant.getTotalBetAmount(), amount));
        participantRepository.save(participant);

        // --- 2) Statistics ---
        final PlayerStats stats = loadOrCreate(address);
        stats.setTotalBets(TokenMath.add(stats.getTotalBets(), amount));
        stats.setBetCount(stats.getBetCount() + 1);

        final long last = stats.getLastParticipatedRound();
        if (last != roundId) {
            if (last != 0 && last == roundId - 1) {
                stats.setConsecutiveRounds(stats.getConsecutiveRounds() + 1);
            } else {
                stats.setConsecutiveRounds(1);
            }
            stats.setLastParticipatedRound(roundId);
        }
        stats.setEligibleForGift(stats.getConsecutiveRounds() >= properties.getRounds().getConsecutivePlayRequirement());

        log.debug("[STATS] address={}, round={}, consecutive={}, giftEligible={}",
                address, roundId, stats.getConsecutiveRounds(), stats.isEligibleForGift());
        return playerStatsRepository.save(stats);
    }

    @Transactional
    public void recordWinnings(String address, BigDecimal amount) {
        final PlayerStats stats = loadOrCreate(address);
        stats.setTotalWinnings(TokenMath.add(stats.getTotalWinnings(), amount));
        playerStatsRepository.save(stats);
    }

    @Transactional
    public void recordGift(String address, long roundId) {
        final PlayerStats stats = loadOrCreate(address);
        stats.setLastGiftRound(roundId);
        playerStatsRepository.save(stats);
    }

    /** Amount already wagered by {@code address} in {@code roundId}. */
    @Transactional(readOnly = true)
    public BigDecimal wageredInRound(long roundId, String address) {
        return participantRepository.findByRoundIdAndAddress(roundId, address)
                .map(RoundParticipant::getTotalBetAmount)
                .orElse(TokenMath.ZERO);
    }

    @Transactional(readOnly = true)
    public List<String> participants(long roundId) {
        return participantRepository.findByRoundIdOrderByJoinOrderAsc(roundId).stream()
                .map(RoundParticipant::getAddress)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<PlayerStats> findStats(String address) {
        return address == null ? Optional.empty() : playerStatsRepository.findById(address);
    }

    @Transactional(readOnly = true)
    public List<PlayerStats> findStats(List<String> addresses) {
        return playerStatsRepository.findByAddressIn(addresses);
    }

    private PlayerStats loadOrCreate(String address) {
        return playerStatsRepository.findById(address).orElseGet(() -> PlayerStats.empty(address));
    }
}
