package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.EngineState;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.EngineStateRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Round arena and engine singleton: which round is current, opening the next one, the
 * pause flag and the payout cap. Internal to the engine; callers hold the {@link CallGuard}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundRegistry {

    private final EngineStateRepository engineStateRepository;
    private final RoundRepository roundRepository;
    private final LotteryProperties properties;

    @Transactional
    public EngineState initializeState() {
        return engineStateRepository.findById(EngineState.SINGLETON_ID).orElseGet(() -> {
            final EngineState state = EngineState.builder()
                    .id(EngineState.SINGLETON_ID)
                    .currentRoundId(0L)
                    .paused(false)
                    .maxPayoutPerRound(TokenMath.normalize(properties.getRounds().getMaxPayoutPerRound()))
                    .build();
            log.info("[ROUND] Initialized engine state maxPayoutPerRound={}", state.getMaxPayoutPerRound());
            return engineStateRepository.save(state);
        });
    }

    @Transactional(readOnly = true)
    public EngineState engineState() {
        return engineStateRepository.findById(EngineState.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Engine state is not initialized"));
    }

    @Transactional(readOnly = true)
    public long currentRoundId() {
        return engineStateRepository.findById(EngineState.SINGLETON_ID)
                .map(EngineState::getCurrentRoundId)
                .orElse(0L);
    }

    @Transactional(readOnly = true)
    public Round currentRound() {
        return requireRound(currentRoundId());
    }

    @Transactional(readOnly = true)
    public Round requireRound(long roundId) {
        return roundRepository.findById(roundId).orElseThrow(() -> LotteryException.roundNotFound(roundId));
    }

    /** Opens round {@code roundId} starting at {@code now} and makes it current. */
    @Transactional
    public Round openRound(long roundId, Instant now) {
        final EngineState state = engineState();
        final Round round = roundRepository.save(Round.open(roundId, now, properties.getRounds().getDuration()));
        state.setCurrentRoundId(roundId);
        engineStateRepository.save(state);
        log.info("[ROUND] Opened round={}, start={}, end={}", roundId, round.getStartTime(), round.getEndTime());
        return round;
    }

    /**
     * Opens the successor of {@code drawnRoundId} if that round is still the current one.
     * Returns the new round, or empty when a later round is already current.
     */
    @Transactional
    public Optional<Round> openNextRoundIfCurrent(long drawnRoundId, Instant now) {
        if (currentRoundId() != drawnRoundId) {
            log.info("[ROUND] Round={} drawn but not current (current={}); no round opened", drawnRoundId, currentRoundId());
            return Optional.empty();
        }
        return Optional.of(openRound(drawnRoundId + 1, now));
    }

    @Transactional(readOnly = true)
    public boolean isPaused() {
        return engineStateRepository.findById(EngineState.SINGLETON_ID)
                .map(EngineState::isPaused)
                .orElse(false);
    }

    @Transactional
    public void setPaused(boolean paused) {
        final EngineState state = engineState();
        state.setPaused(paused);
        engineStateRepository.save(state);
    }

    @Transactional(readOnly = true)
    public BigDecimal maxPayoutPerRound() {
        return engineState().getMaxPayoutPerRound();
    }

    @Transactional
    public void setMaxPayoutPerRound(BigDecimal value) {
        final EngineState state = engineState();
        state.setMaxPayoutPerRound(TokenMath.normalize(value));
        engineStateRepository.save(state);
    }
}
