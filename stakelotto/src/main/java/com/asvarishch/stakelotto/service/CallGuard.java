package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.SerialLock;
import com.asvarishch.stakelotto.repository.SerialLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Wraps every externally callable state-mutating operation.
 * <ul>
 *   <li>Rejects entry while another guarded operation runs on the same thread (reentrancy).</li>
 *   <li>Locks the global {@link SerialLock} row with {@code PESSIMISTIC_WRITE}; the lock is held
 *       until the caller's transaction ends, so writers execute one at a time across threads
 *       and nodes, and each sees the state committed by the previous one.</li>
 * </ul>
 * Must be called inside a transaction. The lock row is created once at startup by {@link #seed()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallGuard {

    private static final ThreadLocal<String> ACTIVE_OPERATION = new ThreadLocal<>();

    private final SerialLockRepository serialLockRepository;

    public <T> T call(String operation, Supplier<T> body) {
        final String active = ACTIVE_OPERATION.get();
        if (active != null) {
            log.warn("[GUARD] Rejected reentrant call to {} while {} is executing", operation, active);
            throw LotteryException.reentrantCall(operation, active);
        }
        ACTIVE_OPERATION.set(operation);
        try {
            acquireSerialLock();
            return body.get();
        } finally {
            ACTIVE_OPERATION.remove();
        }
    }

    public void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }

    public boolean isActive() {
        return ACTIVE_OPERATION.get() != null;
    }

    /** Creates the global lock row if absent. Runs outside any transaction, before the first guarded call. */
    public void seed() {
        if (serialLockRepository.existsById(SerialLock.GLOBAL)) {
            return;
        }
        try {
            serialLockRepository.saveAndFlush(new SerialLock(SerialLock.GLOBAL));
            log.info("[GUARD] Created serial lock row {}", SerialLock.GLOBAL);
        } catch (DataIntegrityViolationException e) {
            // Another node inserted it between the check and the insert.
            log.info("[GUARD] Serial lock row {} already created by another node: {}",
                    SerialLock.GLOBAL, e.getMostSpecificCause().getMessage());
        }
    }

    private void acquireSerialLock() {
        serialLockRepository.findByIdForUpdate(SerialLock.GLOBAL)
                .orElseThrow(() -> new IllegalStateException(
                        "Serial lock row '" + SerialLock.GLOBAL + "' is missing; seed() has not run"));
    }
}
