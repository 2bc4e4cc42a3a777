package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.ClaimResultDTO;
import com.asvarishch.stakelotto.enums.RoundPhase;
import com.asvarishch.stakelotto.exception.ErrorCode;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.Bet;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.BetRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.repository.SerialLockRepository;
import com.asvarishch.stakelotto.support.GuardStubs;
import com.asvarishch.stakelotto.support.MutableClock;
import com.asvarishch.stakelotto.util.TokenMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoundService tests")
class RoundServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final List<Integer> NUMBERS = List.of(1, 5, 15, 25, 35);
    private static final String ENGINE = "lottery-engine";

    @Mock
    private RoundRegistry roundRegistry;

    @Mock
    private RoundRepository roundRepository;

    @Mock
    private BetRepository betRepository;

    @Mock
    private ParticipationService participationService;

    @Mock
    private TokenLedgerService tokenLedger;

    @Mock
    private RandomnessGateway randomnessGateway;

    @Mock
    private SerialLockRepository serialLockRepository;

    private MutableClock clock;
    private LotteryProperties properties;
    private RoundService service;
    private Round round;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new LotteryProperties();
        round = Round.open(1L, T0, properties.getRounds().getDuration());
        service = new RoundService(roundRegistry, roundRepository, betRepository, participationService, tokenLedger,
                randomnessGateway, new PayoutCalculator(properties), properties,
                GuardStubs.callGuard(serialLockRepository), clock);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static BigDecimal amount(String value) {
        return TokenMath.normalize(new BigDecimal(value));
    }

    private static ErrorCode codeOf(Throwable t) {
        return ((LotteryException) t).getCode();
    }

    private Bet bet(int index, String bettor, String stake, int matchCount) {
        return Bet.builder()
                .betId((long) index + 1)
                .roundId(1L)
                .betIndex(index)
                .bettor(bettor)
                .numbers(new ArrayList<>(NUMBERS))
                .amount(amount(stake))
                .placedAt(T0)
                .matchCount(matchCount)
                .build();
    }

    private void drawRound() {
        round.setStatus(RoundPhase.DRAWN);
        round.setWinningNumbers(new ArrayList<>(NUMBERS));
        when(roundRegistry.requireRound(1L)).thenReturn(round);
    }

    private void stubEligibleBettor(String bettor) {
        when(roundRegistry.currentRound()).thenReturn(round);
        when(participationService.wageredInRound(1L, bettor)).thenReturn(TokenMath.ZERO);
        when(tokenLedger.stakingWeight(bettor)).thenReturn(amount("100"));
        when(betRepository.save(any(Bet.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ---------------------------------------------------------------------
    // placeBet()
    // ---------------------------------------------------------------------

    @Nested
    @DisplayName("placeBet()")
    class PlaceBet {

        @Test
        @DisplayName("Collects the wager, appends the bet and updates round totals and statistics")
        void placeBet_success() {
            stubEligibleBettor("alice");

            Bet bet = service.placeBet("alice", NUMBERS, new BigDecimal("10"));

            assertThat(bet.getBetIndex()).isZero();
            assertThat(bet.getNumbers()).containsExactlyElementsOf(NUMBERS);
            assertThat(round.getBetCount()).isEqualTo(1);
            assertThat(round.getTotalBetAmount()).isEqualByComparingTo("10");
            assertThat(round.getTotalPrizePool()).isEqualByComparingTo("9.5");
            verify(tokenLedger).transferInternal("alice", ENGINE, amount("10"));
            verify(participationService).recordParticipation(1L, "alice", amount("10"));
            verifyNoInteractions(randomnessGateway);
        }

        @Test
        @DisplayName("Second bet of the round gets the next index")
        void placeBet_indexes() {
            stubEligibleBettor("alice");
            round.setBetCount(3);

            Bet bet = service.placeBet("alice", NUMBERS, new BigDecimal("1"));

            assertThat(bet.getBetIndex()).isEqualTo(3);
            assertThat(round.getBetCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Paused engine rejects bets")
        void placeBet_paused() {
            when(roundRegistry.isPaused()).thenReturn(true);

            assertThatThrownBy(() -> service.placeBet("alice", NUMBERS, new BigDecimal("10")))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ENGINE_PAUSED));
        }

        @Test
        @DisplayName("Unsorted numbers are rejected and no tokens move")
        void placeBet_unsorted() {
            assertThatThrownBy(() -> service.placeBet("alice", List.of(5, 1, 15, 25, 35), new BigDecimal("10")))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.INVALID_NUMBERS));
            verifyNoInteractions(tokenLedger, betRepository);
        }

        @Test
        @DisplayName("Amount under MIN_BET is rejected")
        void placeBet_belowMinBet() {
            assertThatThrownBy(() -> service.placeBet("alice", NUMBERS, new BigDecimal("0.5")))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.BELOW_MIN_BET));
        }

        @Test
        @DisplayName("Cumulative wager above the per-round cap is rejected")
        void placeBet_exceedsMaxBet() {
            when(roundRegistry.currentRound()).thenReturn(round);
            when(participationService.wageredInRound(1L, "alice")).thenReturn(amount("995"));

            assertThatThrownBy(() -> service.placeBet("alice", NUMBERS, new BigDecimal("10")))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.EXCEEDS_MAX_BET));
            verify(tokenLedger, never()).transferInternal(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Staking weight under MIN_STAKE makes the bettor ineligible")
        void placeBet_notEligible() {
            when(roundRegistry.currentRound()).thenReturn(round);
            when(participationService.wageredInRound(1L, "alice")).thenReturn(TokenMath.ZERO);
            when(tokenLedger.stakingWeight("alice")).thenReturn(amount("9"));

            assertThatThrownBy(() -> service.placeBet("alice", NUMBERS, new BigDecimal("10")))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.NOT_ELIGIBLE));
        }

        @Test
        @DisplayName("Round past its end time is CLOSED for betting")
        void placeBet_closed() {
            when(roundRegistry.currentRound()).thenReturn(round);
            clock.advance(Duration.ofDays(7));

            assertThatThrownBy(() -> service.placeBet("alice", NUMBERS, new BigDecimal("10")))
                    .isInstanceOf(LotteryException.class)
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ROUND_NOT_OPEN))
                    .hasMessageContaining("CLOSED");
        }
    }

    // ---------------------------------------------------------------------
    // endRound()
    // ---------------------------------------------------------------------

    @Nested
    @DisplayName("endRound()")
    class EndRound {

        @Test
        @DisplayName("Before the end time fails with ROUND_NOT_ENDED")
        void endRound_tooEarly() {
            when(roundRegistry.currentRound()).thenReturn(round);
            clock.advance(Duration.ofDays(7).minusSeconds(1));

            assertThatThrownBy(() -> service.endRound())
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ROUND_NOT_ENDED));
            verifyNoInteractions(randomnessGateway);
        }

        @Test
        @DisplayName("After the end time requests five values and awaits the draw; a second call fails")
        void endRound_requestsRandomness() {
            when(roundRegistry.currentRound()).thenReturn(round);
            when(randomnessGateway.request(1L, 5)).thenReturn(42L);
            clock.advance(Duration.ofDays(7));

            long requestId = service.endRound();

            assertThat(requestId).isEqualTo(42L);
            assertThat(round.getStatus()).isEqualTo(RoundPhase.AWAITING_DRAW);
            assertThat(round.getPendingRandomnessRequestId()).isEqualTo(42L);
            assertThatThrownBy(() -> service.endRound())
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.DRAW_ALREADY_REQUESTED));
            verify(randomnessGateway, times(1)).request(anyLong(), anyInt());
        }

        @Test
        @DisplayName("Drawn round cannot be ended again")
        void endRound_drawn() {
            round.setStatus(RoundPhase.DRAWN);
            when(roundRegistry.currentRound()).thenReturn(round);

            assertThatThrownBy(() -> service.endRound())
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ROUND_ALREADY_DRAWN));
        }
    }

    // ---------------------------------------------------------------------
    // claimWinnings() / getClaimableWinnings()
    // ---------------------------------------------------------------------

    @Nested
    @DisplayName("claimWinnings()")
    class Claims {

        @Test
        @DisplayName("Pays five matches at 800x less house edge; skips others' and losing bets")
        void claim_success() {
            drawRound();
            Bet jackpot = bet(0, "alice", "10", 5);
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(jackpot));
            when(betRepository.findByRoundIdAndBetIndex(1L, 1)).thenReturn(Optional.of(bet(1, "bob", "10", 5)));
            when(betRepository.findByRoundIdAndBetIndex(1L, 2)).thenReturn(Optional.of(bet(2, "alice", "10", 1)));
            when(betRepository.findClaimedWinningBets(1L, 2)).thenReturn(List.of());
            when(roundRegistry.maxPayoutPerRound()).thenReturn(amount("100000"));

            ClaimResultDTO result = service.claimWinnings("alice", 1L, List.of(0, 1, 2));

            assertThat(result.totalPayout()).isEqualByComparingTo("7600");
            assertThat(result.paidBetIndices()).containsExactly(0);
            assertThat(jackpot.isClaimed()).isTrue();
            verify(tokenLedger).transferInternal(ENGINE, "alice", amount("7600"));
            verify(participationService).recordWinnings("alice", amount("7600"));
        }

        @Test
        @DisplayName("Claiming an already claimed bet fails with ALREADY_CLAIMED")
        void claim_twice() {
            drawRound();
            Bet claimed = bet(0, "alice", "10", 3);
            claimed.setClaimed(true);
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(claimed));

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ALREADY_CLAIMED));
            verify(tokenLedger, never()).transferInternal(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("The same index twice in one call fails with ALREADY_CLAIMED")
        void claim_duplicateIndex() {
            drawRound();
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(bet(0, "alice", "10", 3)));

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0, 0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.ALREADY_CLAIMED));
        }

        @Test
        @DisplayName("A losing bet listed twice is skipped, not reported as ALREADY_CLAIMED")
        void claim_duplicateLosingIndex() {
            drawRound();
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(bet(0, "alice", "10", 1)));

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0, 0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.NO_WINNINGS));
        }

        @Test
        @DisplayName("A duplicated losing index does not block the winning bets next to it")
        void claim_duplicateLosingIndexWithWinner() {
            drawRound();
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(bet(0, "alice", "10", 1)));
            when(betRepository.findByRoundIdAndBetIndex(1L, 1)).thenReturn(Optional.of(bet(1, "alice", "10", 5)));
            when(betRepository.findClaimedWinningBets(1L, 2)).thenReturn(List.of());
            when(roundRegistry.maxPayoutPerRound()).thenReturn(amount("100000"));

            ClaimResultDTO result = service.claimWinnings("alice", 1L, List.of(0, 0, 1));

            assertThat(result.paidBetIndices()).containsExactly(1);
            assertThat(result.totalPayout()).isEqualByComparingTo("7600");
        }

        @Test
        @DisplayName("Only losing bets fails with NO_WINNINGS")
        void claim_noWinnings() {
            drawRound();
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(bet(0, "alice", "10", 1)));

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.NO_WINNINGS));
        }

        @Test
        @DisplayName("Later claim over the round's payout cap fails while earlier claims stand")
        void claim_payoutCap() {
            drawRound();
            Bet alice = bet(0, "alice", "10", 5);
            Bet bobPaid = bet(1, "bob", "10", 5);
            bobPaid.setClaimed(true);
            when(betRepository.findByRoundIdAndBetIndex(1L, 0)).thenReturn(Optional.of(alice));
            when(betRepository.findClaimedWinningBets(1L, 2)).thenReturn(List.of(bobPaid));
            when(roundRegistry.maxPayoutPerRound()).thenReturn(amount("10000"));

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.PAYOUT_EXCEEDS_MAXIMUM));
            assertThat(alice.isClaimed()).isFalse();
            verify(tokenLedger, never()).transferInternal(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Undrawn round fails with NUMBERS_NOT_DRAWN")
        void claim_notDrawn() {
            when(roundRegistry.requireRound(1L)).thenReturn(round);

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(0)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.NUMBERS_NOT_DRAWN));
        }

        @Test
        @DisplayName("Unknown bet index fails with BET_NOT_FOUND")
        void claim_unknownIndex() {
            drawRound();
            when(betRepository.findByRoundIdAndBetIndex(1L, 9)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.claimWinnings("alice", 1L, List.of(9)))
                    .satisfies(t -> assertThat(codeOf(t)).isEqualTo(ErrorCode.BET_NOT_FOUND));
        }

        @Test
        @DisplayName("Claimable view: three matches pay 8x less edge, zero matches pay nothing")
        void claimable() {
            round.setStatus(RoundPhase.DRAWN);
            when(roundRepository.findById(1L)).thenReturn(Optional.of(round));
            when(betRepository.findByRoundIdAndBettorOrderByBetIndexAsc(1L, "alice"))
                    .thenReturn(List.of(bet(0, "alice", "10", 3)));
            when(betRepository.findByRoundIdAndBettorOrderByBetIndexAsc(1L, "bob"))
                    .thenReturn(List.of(bet(1, "bob", "10", 0)));

            assertThat(service.getClaimableWinnings(1L, "alice")).isEqualByComparingTo("76");
            assertThat(service.getClaimableWinnings(1L, "bob")).isZero();
        }
    }
}
