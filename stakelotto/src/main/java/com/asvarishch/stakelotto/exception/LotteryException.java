package com.asvarishch.stakelotto.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Single unchecked failure type of the engine. Thrown before any write, or from inside the
 * transaction of the failing call so that the whole call rolls back.
 */
@Getter
public class LotteryException extends RuntimeException {

    private final ErrorCode code;

    public LotteryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public static LotteryException zeroAmount() {
        return new LotteryException(ErrorCode.ZERO_AMOUNT, "Amount must be greater than zero");
    }

    public static LotteryException invalidNumbers(List<Integer> numbers, String reason) {
        return new LotteryException(ErrorCode.INVALID_NUMBERS, "Invalid numbers " + numbers + ": " + reason);
    }

    public static LotteryException belowMinBet(BigDecimal amount, BigDecimal minBet) {
        return new LotteryException(ErrorCode.BELOW_MIN_BET, "Bet amount " + amount + " is below minimum " + minBet);
    }

    public static LotteryException invalidAddress(String address) {
        return new LotteryException(ErrorCode.INVALID_ADDRESS, "Invalid address: '" + address + "'");
    }

    public static LotteryException invalidParameterValue(String detail) {
        return new LotteryException(ErrorCode.INVALID_PARAMETER_VALUE, detail);
    }

    public static LotteryException invalidRandomnessPayload(long requestId, int expected, int actual) {
        return new LotteryException(ErrorCode.INVALID_RANDOMNESS_PAYLOAD,
                "Request " + requestId + " expects " + expected + " random values, got " + actual);
    }

    public static LotteryException belowMinimum(BigDecimal amount, BigDecimal minimum) {
        return new LotteryException(ErrorCode.BELOW_MINIMUM, "Stake " + amount + " is below minimum " + minimum);
    }

    public static LotteryException insufficientBalance(String address, BigDecimal available, BigDecimal required) {
        return new LotteryException(ErrorCode.INSUFFICIENT_BALANCE,
                "Insufficient balance for " + address + ": available=" + available + ", required=" + required);
    }

    public static LotteryException insufficientStaked(String address, BigDecimal staked, BigDecimal requested) {
        return new LotteryException(ErrorCode.INSUFFICIENT_STAKED,
                "Insufficient staked amount for " + address + ": staked=" + staked + ", requested=" + requested);
    }

    public static LotteryException insufficientTransferable(String address, BigDecimal transferable, BigDecimal requested) {
        return new LotteryException(ErrorCode.INSUFFICIENT_TRANSFERABLE,
                "Staked funds are locked for " + address + ": transferable=" + transferable + ", requested=" + requested);
    }

    public static LotteryException insufficientAllowance(String owner, String spender, BigDecimal allowance, BigDecimal requested) {
        return new LotteryException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                "Allowance of " + spender + " over " + owner + " is " + allowance + ", requested=" + requested);
    }

    public static LotteryException durationNotMet(String address, String unlockAt) {
        return new LotteryException(ErrorCode.DURATION_NOT_MET,
                "Minimum staking duration not met for " + address + "; unlocks at " + unlockAt);
    }

    public static LotteryException notEligible(String address, BigDecimal weight, BigDecimal required) {
        return new LotteryException(ErrorCode.NOT_ELIGIBLE,
                "Account " + address + " is not eligible: staking weight " + weight + " < " + required);
    }

    public static LotteryException roundNotOpen(long roundId, Object phase) {
        return new LotteryException(ErrorCode.ROUND_NOT_OPEN, "Round " + roundId + " is not open (phase=" + phase + ")");
    }

    public static LotteryException roundNotEnded(long roundId, String endTime) {
        return new LotteryException(ErrorCode.ROUND_NOT_ENDED, "Round " + roundId + " ends at " + endTime);
    }

    public static LotteryException roundAlreadyDrawn(long roundId) {
        return new LotteryException(ErrorCode.ROUND_ALREADY_DRAWN, "Round " + roundId + " is already drawn");
    }

    public static LotteryException drawAlreadyRequested(long roundId, Long requestId) {
        return new LotteryException(ErrorCode.DRAW_ALREADY_REQUESTED,
                "Round " + roundId + " already awaits randomness request " + requestId);
    }

    public static LotteryException emergencyDrawTooEarly(long roundId, String allowedFrom) {
        return new LotteryException(ErrorCode.EMERGENCY_DRAW_TOO_EARLY,
                "Emergency draw for round " + roundId + " allowed from " + allowedFrom);
    }

    public static LotteryException numbersNotDrawn(long roundId) {
        return new LotteryException(ErrorCode.NUMBERS_NOT_DRAWN, "Round " + roundId + " has not been drawn yet");
    }

    public static LotteryException alreadyClaimed(long roundId, int betIndex) {
        return new LotteryException(ErrorCode.ALREADY_CLAIMED, "Bet " + betIndex + " of round " + roundId + " already claimed");
    }

    public static LotteryException noWinnings(long roundId, String address) {
        return new LotteryException(ErrorCode.NO_WINNINGS, "No winnings for " + address + " in round " + roundId);
    }

    public static LotteryException giftsAlreadyDistributed(long roundId) {
        return new LotteryException(ErrorCode.GIFTS_ALREADY_DISTRIBUTED, "Gifts for round " + roundId + " already distributed");
    }

    public static LotteryException invalidRequest(long requestId) {
        return new LotteryException(ErrorCode.INVALID_REQUEST, "Randomness request " + requestId + " is not outstanding");
    }

    public static LotteryException emergencyModeDisabled() {
        return new LotteryException(ErrorCode.EMERGENCY_MODE_DISABLED, "Emergency mode is not enabled");
    }

    public static LotteryException operationNotScheduled(String operationId) {
        return new LotteryException(ErrorCode.OPERATION_NOT_SCHEDULED, "Operation " + operationId + " is not scheduled");
    }

    public static LotteryException operationAlreadyScheduled(String operationId) {
        return new LotteryException(ErrorCode.OPERATION_ALREADY_SCHEDULED, "Operation " + operationId + " is already scheduled");
    }

    public static LotteryException timelockNotReady(String operationId, String executeTime) {
        return new LotteryException(ErrorCode.TIMELOCK_NOT_READY,
                "Operation " + operationId + " cannot execute before " + executeTime);
    }

    public static LotteryException enginePaused() {
        return new LotteryException(ErrorCode.ENGINE_PAUSED, "Betting and claiming are paused");
    }

    public static LotteryException reentrantCall(String operation, String active) {
        return new LotteryException(ErrorCode.REENTRANT_CALL,
                "Reentrant call to " + operation + " while " + active + " is executing");
    }

    public static LotteryException exceedsMaximum(BigDecimal resulting, BigDecimal maximum) {
        return new LotteryException(ErrorCode.EXCEEDS_MAXIMUM, "Staked amount " + resulting + " would exceed maximum " + maximum);
    }

    public static LotteryException exceedsMaxBet(BigDecimal resulting, BigDecimal maximum) {
        return new LotteryException(ErrorCode.EXCEEDS_MAX_BET,
                "Total bets this round " + resulting + " would exceed maximum " + maximum);
    }

    public static LotteryException exceedsMaxSupply(BigDecimal resulting, BigDecimal maximum) {
        return new LotteryException(ErrorCode.EXCEEDS_MAX_SUPPLY, "Supply " + resulting + " would exceed maximum " + maximum);
    }

    public static LotteryException payoutExceedsMaximum(long roundId, BigDecimal total, BigDecimal cap) {
        return new LotteryException(ErrorCode.PAYOUT_EXCEEDS_MAXIMUM,
                "Round " + roundId + " payout " + total + " exceeds cap " + cap);
    }

    public static LotteryException insufficientReserve(BigDecimal reserve, BigDecimal required) {
        return new LotteryException(ErrorCode.INSUFFICIENT_RESERVE,
                "Gift reserve " + reserve + " does not cover " + required);
    }

    public static LotteryException arithmeticOverflow(String detail) {
        return new LotteryException(ErrorCode.ARITHMETIC_OVERFLOW, "Overflow: " + detail);
    }

    public static LotteryException arithmeticUnderflow(String detail) {
        return new LotteryException(ErrorCode.ARITHMETIC_UNDERFLOW, "Underflow: " + detail);
    }

    public static LotteryException unauthorized(String principal, Object role) {
        return new LotteryException(ErrorCode.UNAUTHORIZED, principal + " lacks role " + role);
    }

    public static LotteryException roundNotFound(long roundId) {
        return new LotteryException(ErrorCode.ROUND_NOT_FOUND, "Round not found: id=" + roundId);
    }

    public static LotteryException betNotFound(long roundId, int betIndex) {
        return new LotteryException(ErrorCode.BET_NOT_FOUND, "Bet not found: round=" + roundId + ", index=" + betIndex);
    }
}
