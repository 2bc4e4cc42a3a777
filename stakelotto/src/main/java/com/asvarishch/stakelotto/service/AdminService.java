package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.enums.TimelockParameter;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.ScheduledOperation;
import com.asvarishch.stakelotto.repository.ScheduledOperationRepository;
import com.asvarishch.stakelotto.util.Addresses;
import com.asvarishch.stakelotto.util.Hashing;
import com.asvarishch.stakelotto.util.TokenMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Admin gateway: timelocked parameter changes, pause switch and emergency withdrawal
 * from the engine account. Every entry point requires ADMIN.
 * <p>
 * Timelock: {@code schedule(p, v)} stores {@code executeTime = now + delay} under
 * {@code sha256(p:v)}; {@code execute(p, v)} applies the change once that time is reached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final ScheduledOperationRepository scheduledOperationRepository;
    private final AccessControlService accessControl;
    private final RoundRegistry roundRegistry;
    private final GiftDistributionService giftDistributionService;
    private final TokenLedgerService tokenLedger;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    @Transactional
    public ScheduledOperation schedule(String admin, TimelockParameter parameter, BigDecimal value) {
        return callGuard.call("scheduleOperation", () -> {
            accessControl.requireRole(admin, Role.ADMIN);
            validate(parameter, value);

            final String operationId = operationId(parameter, value);
            if (scheduledOperationRepository.existsById(operationId)) {
                throw LotteryException.operationAlreadyScheduled(operationId);
            }
            final Instant executeTime = clock.instant().plus(properties.getAdmin().getTimelockDelay());
            final ScheduledOperation operation = scheduledOperationRepository.save(ScheduledOperation.builder()
                    .operationId(operationId)
                    .parameter(parameter)
                    .value(TokenMath.normalize(value))
                    .scheduledBy(admin)
                    .executeTime(executeTime)
                    .build());

            log.info("[ADMIN] Scheduled operationId={}, {}={}, executeTime={}, by={}",
                    operationId, parameter, value.toPlainString(), executeTime, admin);
            return operation;
        });
    }

    @Transactional
    public void execute(String admin, TimelockParameter parameter, BigDecimal value) {
        callGuard.run("executeOperation", () -> {
            accessControl.requireRole(admin, Role.ADMIN);
            validate(parameter, value);

            final String operationId = operationId(parameter, value);
            final ScheduledOperation operation = scheduledOperationRepository.findById(operationId)
                    .orElseThrow(() -> LotteryException.operationNotScheduled(operationId));
            if (clock.instant().isBefore(operation.getExecuteTime())) {
                throw LotteryException.timelockNotReady(operationId, operation.getExecuteTime().toString());
            }

            apply(parameter, value);
            scheduledOperationRepository.delete(operation);
            log.info("[ADMIN] Executed operationId={}, {}={}, by={}", operationId, parameter, value.toPlainString(), admin);
        });
    }

    @Transactional
    public void cancel(String admin, TimelockParameter parameter, BigDecimal value) {
        callGuard.run("cancelOperation", () -> {
            accessControl.requireRole(admin, Role.ADMIN);
            validate(parameter, value);
            final String operationId = operationId(parameter, value);
            final ScheduledOperation operation = scheduledOperationRepository.findById(operationId)
                    .orElseThrow(() -> LotteryException.operationNotScheduled(operationId));
            scheduledOperationRepository.delete(operation);
            log.info("[ADMIN] Cancelled operationId={}, by={}", operationId, admin);
        });
    }

    @Transactional
    public void pause(String admin) {
        setPaused(admin, true);
    }

    @Transactional
    public void unpause(String admin) {
        setPaused(admin, false);
    }

    /** Moves {@code amount} out of the engine account. */
    @Transactional
    public void emergencyWithdraw(String admin, String to, BigDecimal amount) {
        callGuard.run("emergencyWithdraw", () -> {
            accessControl.requireRole(admin, Role.ADMIN);
            Addresses.require(to);
            if (amount == null || amount.signum() == 0) {
                throw LotteryException.zeroAmount();
            }
            tokenLedger.transferInternal(properties.getAccounts().getEngine(), to, TokenMath.normalize(amount));
            log.warn("[ADMIN] Emergency withdrawal to={}, amount={}, by={}", to, amount.toPlainString(), admin);
        });
    }

    @Transactional(readOnly = true)
    public List<ScheduledOperation> scheduledOperations() {
        return scheduledOperationRepository.findAll();
    }

    /** Deterministic key of a (parameter, value) pair; trailing zeros do not matter. */
    public static String operationId(TimelockParameter parameter, BigDecimal value) {
        return Hashing.sha256Hex(parameter.name() + ":" + value.stripTrailingZeros().toPlainString());
    }

    private void setPaused(String admin, boolean paused) {
        callGuard.run(paused ? "pause" : "unpause", () -> {
            accessControl.requireRole(admin, Role.ADMIN);
            roundRegistry.setPaused(paused);
            log.warn("[ADMIN] Engine paused={} by={}", paused, admin);
        });
    }

    private void apply(TimelockParameter parameter, BigDecimal value) {
        switch (parameter) {
            case MAX_PAYOUT_PER_ROUND -> roundRegistry.setMaxPayoutPerRound(value);
            case GIFT_CREATOR_AMOUNT, GIFT_USER_AMOUNT, GIFT_RECIPIENTS_PER_ROUND ->
                    giftDistributionService.applyParameter(parameter, value);
        }
    }

    private static void validate(TimelockParameter parameter, BigDecimal value) {
        if (parameter == null) {
            throw LotteryException.invalidParameterValue("parameter must not be null");
        }
        if (value == null || value.signum() <= 0) {
            throw LotteryException.invalidParameterValue(parameter + " must be positive");
        }
        TokenMath.normalize(value);
        if (parameter == TimelockParameter.GIFT_RECIPIENTS_PER_ROUND) {
            GiftDistributionService.requireRecipientCount(value);
        }
    }
}
