package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.GiftDistributionDTO;
import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.enums.TimelockParameter;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.GiftPayment;
import com.asvarishch.stakelotto.model.GiftReserve;
import com.asvarishch.stakelotto.model.PlayerStats;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.GiftPaymentRepository;
import com.asvarishch.stakelotto.repository.GiftReserveRepository;
import com.asvarishch.stakelotto.repository.RoundRepository;
import com.asvarishch.stakelotto.strategy.EntropySource;
import com.asvarishch.stakelotto.strategy.RecipientSelectionStrategy;
import com.asvarishch.stakelotto.util.Addresses;
import com.asvarishch.stakelotto.util.Hashing;
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
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Post-draw gifts paid from a shared reserve: a fixed amount to the creator, and a fixed
 * amount to up to {@code recipientsPerRound} consecutive players of the round.
 * <p>
 * When more players qualify than there are slots, the subset is chosen from a seed built from
 * the round's winning numbers and environment entropy. The winning numbers are public by then,
 * so the choice can be precomputed by an observer; it is deterministic, not unpredictable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiftDistributionService {

    private static final int MAX_RECIPIENTS_PER_ROUND = 1_000;

    private final GiftReserveRepository reserveRepository;
    private final GiftPaymentRepository paymentRepository;
    private final RoundRepository roundRepository;
    private final ParticipationService participationService;
    private final TokenLedgerService tokenLedger;
    private final AccessControlService accessControl;
    private final RecipientSelectionStrategy recipientSelectionStrategy;
    private final EntropySource entropySource;
    private final LotteryProperties properties;
    private final CallGuard callGuard;
    private final Clock clock;

    @Transactional
    public GiftReserve initialize() {
        return reserveRepository.findById(GiftReserve.SINGLETON_ID).orElseGet(() -> {
            final LotteryProperties.Gift gift = properties.getGift();
            final GiftReserve reserve = GiftReserve.builder()
                    .id(GiftReserve.SINGLETON_ID)
                    .recipientsPerRound(gift.getRecipientsPerRound())
                    .creatorAmount(TokenMath.normalize(gift.getCreatorAmount()))
                    .userAmount(TokenMath.normalize(gift.getUserAmount()))
                    .build();
            log.info("[GIFT] Initialized reserve creatorAmount={}, userAmount={}, recipientsPerRound={}",
                    reserve.getCreatorAmount(), reserve.getUserAmount(), reserve.getRecipientsPerRound());
            return reserveRepository.save(reserve);
        });
    }

    /** Anyone may top up the reserve; tokens move from {@code funder} to the reserve account. */
    @Transactional
    public GiftReserve fundReserve(String funder, BigDecimal amount) {
        return callGuard.call("fundReserve", () -> {
            Addresses.require(funder);
            if (amount == null || amount.signum() == 0) {
                throw LotteryException.zeroAmount();
            }
            final BigDecimal value = TokenMath.normalize(amount);
            final GiftReserve reserve = reserve();

            tokenLedger.transferInternal(funder, properties.getAccounts().getGiftReserve(), value);
            reserve.setBalance(TokenMath.add(reserve.getBalance(), value));
            log.info("[GIFT] Reserve funded by={}, amount={}, balance={}", funder, value, reserve.getBalance());
            return reserveRepository.save(reserve);
        });
    }

    /**
     * Pays the gifts of a drawn round, once.
     * <ol>
     *   <li>Caller must hold DISTRIBUTOR.</li>
     *   <li>Round drawn, gifts not yet distributed, reserve covers the full per-round cost.</li>
     *   <li>Mark the round, pay the creator.</li>
     *   <li>Eligible = participants in join order that are gift-eligible, not the creator, and out of cooldown.</li>
     *   <li>Pick at most {@code recipientsPerRound} of them and pay each.</li>
     * </ol>
     */
    @Transactional
    public GiftDistributionDTO distributeGifts(String distributor, long roundId) {
        return callGuard.call("distributeGifts", () -> {
            accessControl.requireRole(distributor, Role.DISTRIBUTOR);

            // --- 1) Preconditions ---
            final Round round = roundRepository.findById(roundId)
                    .orElseThrow(() -> LotteryException.roundNotFound(roundId));
            if (!round.isDrawn()) {
                throw LotteryException.numbersNotDrawn(roundId);
            }
            if (round.isGiftsDistributed()) {
                throw LotteryException.giftsAlreadyDistributed(roundId);
            }
            final GiftReserve reserve = reserve();
            final BigDecimal cost = reserve.costPerRound();
            if (reserve.getBalance().compareTo(cost) < 0) {
                throw LotteryException.insufficientReserve(reserve.getBalance(), cost);
            }

            // --- 2) Mark round and pay creator ---
            round.setGiftsDistributed(true);
            roundRepository.save(round);

            final Instant now = clock.instant();
            final String creator = properties.getAccounts().getCreator();
            BigDecimal paid = pay(reserve, roundId, creator, reserve.getCreatorAmount(), true, now);

            // --- 3) Eligible recipients ---
            final List<String> eligible = eligibleRecipients(roundId, creator);
            final List<String> selected = eligible.size() > reserve.getRecipientsPerRound()
                    ? recipientSelectionStrategy.select(eligible, reserve.getRecipientsPerRound(), selectionSeed(round))
                    : eligible;

            // --- 4) Pay recipients ---
            for (String recipient : selected) {
                paid = TokenMath.add(paid, pay(reserve, roundId, recipient, reserve.getUserAmount(), false, now));
                participationService.recordGift(recipient, roundId);
            }
            reserve.setTotalDistributed(TokenMath.add(reserve.getTotalDistributed(), paid));
            reserveRepository.save(reserve);

            log.info("[GIFT] Distributed round={}, eligible={}, recipients={}, paid={}, reserveLeft={}",
                    roundId, eligible.size(), selected.size(), paid, reserve.getBalance());
            return GiftDistributionDTO.builder()
                    .roundId(roundId)
                    .creator(creator)
                    .creatorAmount(reserve.getCreatorAmount())
                    .recipients(List.copyOf(selected))
                    .userAmount(reserve.getUserAmount())
                    .totalPaid(paid)
                    .remainingReserve(reserve.getBalance())
                    .build();
        });
    }

    /** Applies an executed timelock change to the gift configuration. Caller holds the guard. */
    @Transactional
    public void applyParameter(TimelockParameter parameter, BigDecimal value) {
        final GiftReserve reserve = reserve();
        switch (parameter) {
            case GIFT_CREATOR_AMOUNT -> reserve.setCreatorAmount(TokenMath.normalize(value));
            case GIFT_USER_AMOUNT -> reserve.setUserAmount(TokenMath.normalize(value));
            case GIFT_RECIPIENTS_PER_ROUND -> reserve.setRecipientsPerRound(requireRecipientCount(value));
            default -> throw new IllegalArgumentException("Not a gift parameter: " + parameter);
        }
        reserveRepository.save(reserve);
        log.info("[GIFT] Configuration {} set to {}", parameter, value.stripTrailingZeros().toPlainString());
    }

    @Transactional(readOnly = true)
    public GiftReserve reserveSnapshot() {
        return reserve();
    }

    @Transactional(readOnly = true)
    public List<GiftPayment> paymentsForRound(long roundId) {
        return paymentRepository.findByRoundIdOrderByPaymentIdAsc(roundId);
    }

    /** Whole rounds covered by the gift cooldown. */
    public long cooldownRounds() {
        final long roundSeconds = properties.getRounds().getDuration().toSeconds();
        return roundSeconds <= 0 ? 0 : properties.getGift().getCooldown().toSeconds() / roundSeconds;
    }

    static int requireRecipientCount(BigDecimal value) {
        final int count;
        try {
            count = value.intValueExact();
        } catch (ArithmeticException e) {
            throw LotteryException.invalidParameterValue("Recipient count must be a whole number: " + value.toPlainString());
        }
        if (count < 1 || count > MAX_RECIPIENTS_PER_ROUND) {
            throw LotteryException.invalidParameterValue("Recipient count out of range [1," + MAX_RECIPIENTS_PER_ROUND + "]: " + count);
        }
        return count;
    }

    private List<String> eligibleRecipients(long roundId, String creator) {
        final List<String> participants = participationService.participants(roundId);
        final Map<String, PlayerStats> stats = participationService.findStats(participants).stream()
                .collect(Collectors.toMap(PlayerStats::getAddress, Function.identity()));
        final long cooldown = cooldownRounds();

        final List<String> eligible = new ArrayList<>();
        for (String address : participants) {
            final PlayerStats s = stats.get(address);
            if (s == null || !s.isEligibleForGift() || address.equals(creator)) {
                continue;
            }
            if (s.getLastGiftRound() == 0 || roundId - s.getLastGiftRound() > cooldown) {
                eligible.add(address);
            }
        }
        return eligible;
    }

    private byte[] selectionSeed(Round round) {
        return Hashing.sha256(
                Hashing.bytes(LotteryNumbers.encode(round.getWinningNumbers())),
                Hashing.bytes(round.getRoundId()),
                entropySource.entropyFor(round.getRoundId()));
    }

    private BigDecimal pay(GiftReserve reserve, long roundId, String recipient, BigDecimal amount,
                           boolean creatorShare, Instant now) {
        if (amount.signum() == 0) {
            return TokenMath.ZERO;
        }
        tokenLedger.transferInternal(properties.getAccounts().getGiftReserve(), recipient, amount);
        reserve.setBalance(TokenMath.subtract(reserve.getBalance(), amount));
        paymentRepository.save(GiftPayment.builder()
                .roundId(roundId)
                .recipient(recipient)
                .amount(amount)
                .creatorShare(creatorShare)
                .paidAt(now)
                .build());
        return amount;
    }

    private GiftReserve reserve() {
        return reserveRepository.findById(GiftReserve.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Gift reserve is not initialized"));
    }
}
