package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.RandomnessRequestMessage;
import com.asvarishch.stakelotto.enums.RandomnessRequestStatus;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.RandomnessRequest;
import com.asvarishch.stakelotto.repository.RandomnessRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Request/fulfil bookkeeping for the external randomness oracle.
 * <p>
 * Each request moves {@code REQUESTED -> FULFILLED} at most once, or stays REQUESTED forever.
 * The flag flips before the consumer runs, so a replayed or concurrent delivery for the same
 * id is rejected with {@code INVALID_REQUEST}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RandomnessGateway {

    private final RandomnessRequestRepository requestRepository;
    private final RandomnessOracle oracle;
    private final RandomnessConsumer consumer;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    /**
     * Records an outstanding request for {@code roundId} and hands it to the oracle once the
     * surrounding transaction commits. Called by the round engine from inside its guarded call.
     *
     * @return the new request id
     */
    @Transactional
    public long request(long roundId, int numValues) {
        if (numValues <= 0) {
            throw LotteryException.invalidParameterValue("numValues must be positive: " + numValues);
        }
        final RandomnessRequest request = requestRepository.save(RandomnessRequest.builder()
                .roundId(roundId)
                .numValues(numValues)
                .requestedAt(clock.instant())
                .build());

        final LotteryProperties.Randomness cfg = properties.getRandomness();
        final RandomnessRequestMessage message = RandomnessRequestMessage.builder()
                .requestId(request.getRequestId())
                .roundId(roundId)
                .numValues(numValues)
                .keyHash(cfg.getKeyHash())
                .subscriptionId(cfg.getSubscriptionId())
                .requestConfirmations(cfg.getRequestConfirmations())
                .callbackGasLimit(cfg.getCallbackGasLimit())
                .requestedAt(request.getRequestedAt())
                .build();

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    oracle.requestRandomness(message);
                }
            });
        } else {
            oracle.requestRandomness(message);
        }

        log.info("[RANDOMNESS] Requested requestId={}, round={}, numValues={}", request.getRequestId(), roundId, numValues);
        return request.getRequestId();
    }

    /**
     * Inbound oracle callback.
     * <ol>
     *   <li>Reject unknown or no longer outstanding ids (replay protection).</li>
     *   <li>Reject payloads with the wrong number of values; the request stays outstanding.</li>
     *   <li>Mark the request fulfilled, then notify the consumer synchronously.</li>
     * </ol>
     */
    @Transactional
    public void deliver(long requestId, List<BigInteger> values) {
        callGuard.run("deliverRandomness", () -> {
            final RandomnessRequest request = requestRepository.findById(requestId).orElse(null);
            if (request == null || !request.isOutstanding()) {
                log.warn("[RANDOMNESS] Rejected delivery for requestId={}: not outstanding", requestId);
                throw LotteryException.invalidRequest(requestId);
            }
            final int actual = values == null ? 0 : values.size();
            if (actual != request.getNumValues() || values.stream().anyMatch(v -> v == null || v.signum() < 0)) {
                throw LotteryException.invalidRandomnessPayload(requestId, request.getNumValues(), actual);
            }

            final Instant now = clock.instant();
            request.setStatus(RandomnessRequestStatus.FULFILLED);
            request.setFulfilledAt(now);
            requestRepository.save(request);
            log.info("[RANDOMNESS] Fulfilled requestId={}, round={}", requestId, request.getRoundId());

            consumer.onRandomnessFulfilled(requestId, request.getRoundId(), List.copyOf(values));
        });
    }

    @Transactional(readOnly = true)
    public boolean isOutstanding(long requestId) {
        return requestRepository.findById(requestId).map(RandomnessRequest::isOutstanding).orElse(false);
    }
}
