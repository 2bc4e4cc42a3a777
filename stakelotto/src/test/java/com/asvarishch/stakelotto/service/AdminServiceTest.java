package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.enums.TimelockParameter;
import com.asvarishch.stakelotto.exception.ErrorCode;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.ScheduledOperation;
import com.asvarishch.stakelotto.repository.ScheduledOperationRepository;
import com.asvarishch.stakelotto.repository.SerialLockRepository;
import com.asvarishch.stakelotto.support.GuardStubs;
import com.asvarishch.stakelotto.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminService tests")
class AdminServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final BigDecimal NEW_CAP = new BigDecimal("50000");

    @Mock
    private ScheduledOperationRepository scheduledOperationRepository;

    @Mock
    private AccessControlService accessControl;

    @Mock
    private RoundRegistry roundRegistry;

    @Mock
    private GiftDistributionService giftDistributionService;

    @Mock
    private TokenLedgerService tokenLedger;

    @Mock
    private SerialLockRepository serialLockRepository;

    private final Map<String, ScheduledOperation> operations = new HashMap<>();
    private MutableClock clock;
    private AdminService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        lenient().when(scheduledOperationRepository.save(any(ScheduledOperation.class))).thenAnswer(inv -> {
            ScheduledOperation op = inv.getArgument(0);
            operations.put(op.getOperationId(), op);
            return op;
        });
        lenient().when(scheduledOperationRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(operations.get(inv.<String>getArgument(0))));
        lenient().when(scheduledOperationRepository.existsById(anyString()))
                .thenAnswer(inv -> operations.containsKey(inv.<String>getArgument(0)));
        lenient().doAnswer(inv -> operations.remove(inv.<ScheduledOperation>getArgument(0).getOperationId()))
                .when(scheduledOperationRepository).delete(any(ScheduledOperation.class));

        service = new AdminService(scheduledOperationRepository, accessControl, roundRegistry, giftDistributionService,
                tokenLedger, new LotteryProperties(), GuardStubs.callGuard(serialLockRepository), clock);
    }

    @Test
    @DisplayName("schedule() stores execute time now + 24h under the hash of the operation")
    void schedule() {
        ScheduledOperation op = service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);

        verify(accessControl).requireRole("admin", Role.ADMIN);
        assertThat(op.getExecuteTime()).isEqualTo(T0.plus(Duration.ofHours(24)));
        assertThat(op.getOperationId())
                .isEqualTo(AdminService.operationId(TimelockParameter.MAX_PAYOUT_PER_ROUND, new BigDecimal("50000.00")))
                .hasSize(64);
        assertThatThrownBy(() -> service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.OPERATION_ALREADY_SCHEDULED);
    }

    @Test
    @DisplayName("execute() before the delay fails with TIMELOCK_NOT_READY, afterwards applies and clears")
    void execute() {
        service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);
        clock.advance(Duration.ofHours(24).minusSeconds(1));

        assertThatThrownBy(() -> service.execute("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.TIMELOCK_NOT_READY);
        verify(roundRegistry, never()).setMaxPayoutPerRound(any());

        clock.advance(Duration.ofSeconds(1));
        service.execute("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);

        verify(roundRegistry).setMaxPayoutPerRound(NEW_CAP);
        assertThat(operations).isEmpty();
    }

    @Test
    @DisplayName("execute() without a matching schedule fails with OPERATION_NOT_SCHEDULED")
    void execute_notScheduled() {
        service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);
        clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> service.execute("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, new BigDecimal("60000")))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.OPERATION_NOT_SCHEDULED);
    }

    @Test
    @DisplayName("Gift parameters are applied through the gift distributor")
    void execute_giftParameter() {
        service.schedule("admin", TimelockParameter.GIFT_USER_AMOUNT, new BigDecimal("20"));
        clock.advance(Duration.ofDays(1));

        service.execute("admin", TimelockParameter.GIFT_USER_AMOUNT, new BigDecimal("20"));

        verify(giftDistributionService).applyParameter(TimelockParameter.GIFT_USER_AMOUNT, new BigDecimal("20"));
    }

    @Test
    @DisplayName("cancel() removes a pending operation")
    void cancel() {
        service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);

        service.cancel("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP);

        assertThat(operations).isEmpty();
        assertThatThrownBy(() -> service.cancel("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.OPERATION_NOT_SCHEDULED);
    }

    @Test
    @DisplayName("Non-positive values are rejected at schedule time")
    void schedule_invalidValue() {
        assertThatThrownBy(() -> service.schedule("admin", TimelockParameter.MAX_PAYOUT_PER_ROUND, BigDecimal.ZERO))
                .isInstanceOf(LotteryException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(operations).isEmpty();
    }

    @Test
    @DisplayName("pause()/unpause() flip the engine flag")
    void pause() {
        service.pause("admin");
        service.unpause("admin");

        verify(roundRegistry).setPaused(true);
        verify(roundRegistry).setPaused(false);
    }

    @Test
    @DisplayName("emergencyWithdraw() moves funds out of the engine account")
    void emergencyWithdraw() {
        service.emergencyWithdraw("admin", "treasury", new BigDecimal("500"));

        verify(tokenLedger).transferInternal(eq("lottery-engine"), eq("treasury"),
                argThat(v -> v.compareTo(new BigDecimal("500")) == 0));
    }

    @Test
    @DisplayName("Every entry point requires ADMIN")
    void unauthorized() {
        doThrow(LotteryException.unauthorized("mallory", Role.ADMIN))
                .when(accessControl).requireRole("mallory", Role.ADMIN);

        assertThatThrownBy(() -> service.schedule("mallory", TimelockParameter.MAX_PAYOUT_PER_ROUND, NEW_CAP))
                .isInstanceOf(LotteryException.class);
        assertThatThrownBy(() -> service.pause("mallory")).isInstanceOf(LotteryException.class);
        assertThatThrownBy(() -> service.emergencyWithdraw("mallory", "mallory", BigDecimal.TEN))
                .isInstanceOf(LotteryException.class);
        verifyNoInteractions(roundRegistry, tokenLedger);
        assertThat(operations).isEmpty();
    }
}
