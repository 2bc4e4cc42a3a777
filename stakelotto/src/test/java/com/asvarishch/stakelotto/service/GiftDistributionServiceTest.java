package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.GiftDistributionDTO;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.enums.RoundPhase;
import com.asvarishch.stakelotto.enums.TimelockParameter;
import com.asvarishch.stakelotto.exception.ErrorCode;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.GiftPayment;
import com.asvarishch.stakelotto.model.GiftReserve;
import com.asvarishch.stakelotto.model.PlayerStats;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.GiftPaymentRepository;
import com.asvarishch.stakelotto.repository.GiftReserveRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.repository.SerialLockRepository;
import com.asvarishch.stakelotto.strategy.EntropySource;
import com.asvarishch.stakelotto.strategy.impl.SeededShuffleRecipientSelectionStrategy;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GiftDistributionService tests")
class GiftDistributionServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final long ROUND_ID = 10L;

    @Mock
    private GiftReserveRepository reserveRepository;

    @Mock
    private GiftPaymentRepository paymentRepository;

    @Mock
    private RoundRepository roundRepository;

    @Mock
    private ParticipationService participationService;

    @Mock
    private TokenLedgerService tokenLedger;

    @Mock
    private AccessControlService accessControl;

    @Mock
    private EntropySource entropySource;

    @Mock
    private SerialLockRepository serialLockRepository;

    private GiftDistributionService service;
    private GiftReserve reserve;
    private Round round;

    @BeforeEach
    void setUp() {
        LotteryProperties properties = new LotteryProperties();
        reserve = GiftReserve.builder()
                .id(GiftReserve.SINGLETON_ID)
                .recipientsPerRound(10)
                .creatorAmount(amount("100"))
                .userAmount(amount("10"))
                .build();
        round = Round.open(ROUND_ID, T0, properties.getRounds().getDuration());
        round.setStatus(RoundPhase.DRAWN);
        round.setWinningNumbers(new ArrayList<>(List.of(1, 5, 15, 25, 35)));

        lenient().when(reserveRepository.findById(GiftReserve.SINGLETON_ID)).thenReturn(Optional.of(reserve));
        lenient().when(roundRepository.findById(ROUND_ID)).thenReturn(Optional.of(round));
        lenient().when(entropySource.entropyFor(anyLong())).thenReturn(new byte[32]);

        service = new GiftDistributionService(reserveRepository, paymentRepository, roundRepository, participationService,
                tokenLedger, accessControl, new SeededShuffleRecipientSelectionStrategy(), entropySource, properties,
                GuardStubs.callGuard(serialLockRepository), new MutableClock(T0));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static BigDecimal amount(String value) {
        return TokenMath.normalize(new BigDecimal(value));
    }

    private static PlayerStats stats(String address, boolean eligible, long lastGiftRound) {
        PlayerStats s = PlayerStats.empty(address);
        s.setEligibleForGift(eligible);
        s.setConsecutiveRounds(eligible ? 3 : 1);
        s.setLastGiftRound(lastGiftRound);
        return s;
    }

    private void participants(PlayerStats... stats) {
        List<String> addresses = java.util.Arrays.stream(stats).map(PlayerStats::getAddress).toList();
        when(participationService.participants(ROUND_ID)).thenReturn(addresses);
        when(participationService.findStats(addresses)).thenReturn(List.of(stats));
    }

    // ---------------------------------------------------------------------
    // distributeGifts()
    // ---------------------------------------------------------------------

    @Nested
    @DisplayName("distributeGifts()")
    class Distribute {

        @Test
        @DisplayName("Reserve one unit short of the cost fails; exactly the cost succeeds")
        void reserveBoundary() {
            reserve.setBalance(TokenMath.subtract(amount("200"), TokenMath.ONE_UNIT));

            assertThatThrownBy(() -> service.distributeGifts("distributor", ROUND_ID))
                    .isInstanceOf(LotteryException.class)
                    .extracting("code").isEqualTo(ErrorCode.INSUFFICIENT_RESERVE);
            assertThat(round.isGiftsDistributed()).isFalse();
            verifyNoInteractions(tokenLedger);

            reserve.setBalance(TokenMath.add(reserve.getBalance(), TokenMath.ONE_UNIT));
            participants();

            GiftDistributionDTO result = service.distributeGifts("distributor", ROUND_ID);

            assertThat(result.totalPaid()).isEqualByComparingTo("100");
            assertThat(round.isGiftsDistributed()).isTrue();
            verify(tokenLedger).transferInternal("gift-reserve", "creator", amount("100"));
        }

        @Test
        @DisplayName("Pays creator and the consecutive players outside the cooldown")
        void eligibleRecipients() {
            reserve.setBalance(amount("1000"));
            participants(
                    stats("creator", true, 0),
                    stats("alice", true, 0),
                    stats("bob", false, 0),
                    stats("carol", true, 7),   // 3 rounds ago, cooldown is 4 rounds
                    stats("dave", true, 5));

            GiftDistributionDTO result = service.distributeGifts("distributor", ROUND_ID);

            verify(accessControl).requireRole("distributor", Role.DISTRIBUTOR);
            assertThat(result.recipients()).containsExactly("alice", "dave");
            assertThat(result.totalPaid()).isEqualByComparingTo("120");
            assertThat(result.remainingReserve()).isEqualByComparingTo("880");
            assertThat(reserve.getTotalDistributed()).isEqualByComparingTo("120");
            verify(tokenLedger).transferInternal("gift-reserve", "alice", amount("10"));
            verify(tokenLedger).transferInternal("gift-reserve", "dave", amount("10"));
            verify(participationService).recordGift("alice", ROUND_ID);
            verify(participationService).recordGift("dave", ROUND_ID);
            verify(paymentRepository, times(3)).save(any(GiftPayment.class));
        }

        @Test
        @DisplayName("More eligible players than slots: a deterministic subset is paid")
        void subsetSelection() {
            reserve.setBalance(amount("1000"));
            reserve.setRecipientsPerRound(2);
            participants(
                    stats("p1", true, 0), stats("p2", true, 0), stats("p3", true, 0),
                    stats("p4", true, 0), stats("p5", true, 0));

            GiftDistributionDTO result = service.distributeGifts("distributor", ROUND_ID);

            assertThat(result.recipients()).hasSize(2).doesNotHaveDuplicates()
                    .isSubsetOf("p1", "p2", "p3", "p4", "p5");
            verify(entropySource).entropyFor(ROUND_ID);
        }

        @Test
        @DisplayName("Second distribution for the round fails with GIFTS_ALREADY_DISTRIBUTED")
        void alreadyDistributed() {
            round.setGiftsDistributed(true);

            assertThatThrownBy(() -> service.distributeGifts("distributor", ROUND_ID))
                    .isInstanceOf(LotteryException.class)
                    .extracting("code").isEqualTo(ErrorCode.GIFTS_ALREADY_DISTRIBUTED);
        }

        @Test
        @DisplayName("Undrawn round fails with NUMBERS_NOT_DRAWN")
        void notDrawn() {
            round.setStatus(RoundPhase.OPEN);

            assertThatThrownBy(() -> service.distributeGifts("distributor", ROUND_ID))
                    .isInstanceOf(LotteryException.class)
                    .extracting("code").isEqualTo(ErrorCode.NUMBERS_NOT_DRAWN);
        }

        @Test
        @DisplayName("Caller without DISTRIBUTOR is rejected")
        void unauthorized() {
            doThrow(LotteryException.unauthorized("mallory", Role.DISTRIBUTOR))
                    .when(accessControl).requireRole("mallory", Role.DISTRIBUTOR);

            assertThatThrownBy(() -> service.distributeGifts("mallory", ROUND_ID))
                    .isInstanceOf(LotteryException.class)
                    .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
            verifyNoInteractions(tokenLedger);
        }
    }

    // ---------------------------------------------------------------------
    // fundReserve() / applyParameter()
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("fundReserve() pulls tokens from the funder into the reserve")
    void fundReserve() {
        when(reserveRepository.save(any(GiftReserve.class))).thenAnswer(inv -> inv.getArgument(0));

        GiftReserve result = service.fundReserve("sponsor", new BigDecimal("250"));

        assertThat(result.getBalance()).isEqualByComparingTo("250");
        verify(tokenLedger).transferInternal("sponsor", "gift-reserve", amount("250"));
    }

    @Test
    @DisplayName("applyParameter() updates gift amounts and validates the recipient count")
    void applyParameter() {
        service.applyParameter(TimelockParameter.GIFT_USER_AMOUNT, new BigDecimal("15"));
        service.applyParameter(TimelockParameter.GIFT_RECIPIENTS_PER_ROUND, new BigDecimal("4"));

        assertThat(reserve.getUserAmount()).isEqualByComparingTo("15");
        assertThat(reserve.getRecipientsPerRound()).isEqualTo(4);
        assertThat(reserve.costPerRound()).isEqualByComparingTo("160");
        assertThatThrownBy(() -> service.applyParameter(TimelockParameter.GIFT_RECIPIENTS_PER_ROUND, new BigDecimal("2.5")))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
    }

    @Test
    @DisplayName("Cooldown of 30 days over 7 day rounds spans 4 rounds")
    void cooldownRounds() {
        assertThat(service.cooldownRounds()).isEqualTo(4);
    }
}
