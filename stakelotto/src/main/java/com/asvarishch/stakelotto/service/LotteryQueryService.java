package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.dto.AccountSnapshotDTO;
import com.asvarishch.stakelotto.dto.BetSnapshotDTO;
import com.asvarishch.stakelotto.dto.ClaimableWinningsDTO;
import com.asvarishch.stakelotto.dto.GiftPaymentDTO;
import com.asvarishch.stakelotto.dto.GiftReserveDTO;
import com.asvarishch.stakelotto.dto.LedgerSnapshotDTO;
import com.asvarishch.stakelotto.dto.RoundSnapshotDTO;
import com.asvarishch.stakelotto.dto.ScheduledOperationDTO;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.Account;
import com.asvarishch.stakelotto.model.Bet;
import com.asvarishch.stakelotto.model.GiftReserve;
import com.asvarishch.stakelotto.model.LedgerState;
import com.asvarishch.stakelotto.model.PlayerStats;
import com.asvarishch.stakelotto.model.Round;
import com.asvarishch.stakelotto.repository.BetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/** Read-only snapshots for external tooling. Never takes the call guard. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LotteryQueryService {

    private final RoundRegistry roundRegistry;
    private final BetRepository betRepository;
    private final ParticipationService participationService;
    private final TokenLedgerService tokenLedger;
    private final RoundService roundService;
    private final GiftDistributionService giftDistributionService;
    private final AdminService adminService;
    private final Clock clock;

    public long currentRoundId() {
        return roundRegistry.currentRoundId();
    }

    public RoundSnapshotDTO currentRound() {
        return toSnapshot(roundRegistry.currentRound());
    }

    public RoundSnapshotDTO round(long roundId) {
        return toSnapshot(roundRegistry.requireRound(roundId));
    }

    public BetSnapshotDTO bet(long roundId, int betIndex) {
        final Bet bet = betRepository.findByRoundIdAndBetIndex(roundId, betIndex)
                .orElseThrow(() -> LotteryException.betNotFound(roundId, betIndex));
        return BetSnapshotDTO.builder()
                .roundId(bet.getRoundId())
                .betIndex(bet.getBetIndex())
                .bettor(bet.getBettor())
                .numbers(List.copyOf(bet.getNumbers()))
                .amount(bet.getAmount())
                .placedAt(bet.getPlacedAt())
                .matchCount(bet.getMatchCount())
                .claimed(bet.isClaimed())
                .build();
    }

    public ClaimableWinningsDTO claimable(long roundId, String address) {
        roundRegistry.requireRound(roundId);
        return new ClaimableWinningsDTO(roundId, address, roundService.getClaimableWinnings(roundId, address));
    }

    public AccountSnapshotDTO account(String address) {
        final Account account = tokenLedger.findAccount(address).orElseGet(() -> Account.empty(address));
        final PlayerStats stats = participationService.findStats(address).orElseGet(() -> PlayerStats.empty(address));
        return AccountSnapshotDTO.builder()
                .address(address)
                .balance(account.getBalance())
                .stakedAmount(account.getStakedAmount())
                .availableBalance(account.getAvailableBalance())
                .stakingStartedAt(account.getStakingStartedAt())
                .stakingWeight(tokenLedger.stakingWeight(address))
                .eligibleForBenefits(tokenLedger.isEligibleForBenefits(address))
                .totalBets(stats.getTotalBets())
                .betCount(stats.getBetCount())
                .totalWinnings(stats.getTotalWinnings())
                .consecutiveRounds(stats.getConsecutiveRounds())
                .lastParticipatedRound(stats.getLastParticipatedRound())
                .lastGiftRound(stats.getLastGiftRound())
                .eligibleForGift(stats.isEligibleForGift())
                .build();
    }

    public GiftReserveDTO giftReserve() {
        final GiftReserve reserve = giftDistributionService.reserveSnapshot();
        return GiftReserveDTO.builder()
                .balance(reserve.getBalance())
                .costPerRound(reserve.costPerRound())
                .creatorAmount(reserve.getCreatorAmount())
                .userAmount(reserve.getUserAmount())
                .recipientsPerRound(reserve.getRecipientsPerRound())
                .totalDistributed(reserve.getTotalDistributed())
                .build();
    }

    public List<GiftPaymentDTO> giftPayments(long roundId) {
        roundRegistry.requireRound(roundId);
        return giftDistributionService.paymentsForRound(roundId).stream()
                .map(payment -> GiftPaymentDTO.builder()
                        .roundId(payment.getRoundId())
                        .recipient(payment.getRecipient())
                        .amount(payment.getAmount())
                        .creatorShare(payment.isCreatorShare())
                        .paidAt(payment.getPaidAt())
                        .build())
                .toList();
    }

    public LedgerSnapshotDTO ledger() {
        final LedgerState state = tokenLedger.ledgerSnapshot();
        return LedgerSnapshotDTO.builder()
                .totalSupply(state.getTotalSupply())
                .totalStaked(state.getTotalStaked())
                .totalBurned(state.getTotalBurned())
                .emergencyMode(state.isEmergencyMode())
                .build();
    }

    /** Pending timelocked parameter changes, earliest executable first. */
    public List<ScheduledOperationDTO> scheduledOperations() {
        return adminService.scheduledOperations().stream()
                .map(operation -> ScheduledOperationDTO.builder()
                        .operationId(operation.getOperationId())
                        .parameter(operation.getParameter())
                        .value(operation.getValue())
                        .scheduledBy(operation.getScheduledBy())
                        .executeTime(operation.getExecuteTime())
                        .build())
                .sorted(Comparator.comparing(ScheduledOperationDTO::executeTime))
                .toList();
    }

    private RoundSnapshotDTO toSnapshot(Round round) {
        return RoundSnapshotDTO.builder()
                .roundId(round.getRoundId())
                .phase(round.phaseAt(clock.instant()))
                .startTime(round.getStartTime())
                .endTime(round.getEndTime())
                .drawn(round.isDrawn())
                .winningNumbers(List.copyOf(round.getWinningNumbers()))
                .totalBetAmount(round.getTotalBetAmount())
                .totalPrizePool(round.getTotalPrizePool())
                .betCount(round.getBetCount())
                .participants(participationService.participants(round.getRoundId()))
                .giftsDistributed(round.isGiftsDistributed())
                .pendingRandomnessRequestId(round.getPendingRandomnessRequestId())
                .drawSource(round.getDrawSource())
                .drawnAt(round.getDrawnAt())
                .build();
    }
}
