package com.asvarishch.stakelotto.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // validation
    ZERO_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_NUMBERS(ErrorCategory.VALIDATION),
    BELOW_MIN_BET(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    INVALID_PARAMETER_VALUE(ErrorCategory.VALIDATION),
    INVALID_RANDOMNESS_PAYLOAD(ErrorCategory.VALIDATION),

    // eligibility
    BELOW_MINIMUM(ErrorCategory.ELIGIBILITY),
    INSUFFICIENT_BALANCE(ErrorCategory.ELIGIBILITY),
    INSUFFICIENT_STAKED(ErrorCategory.ELIGIBILITY),
    INSUFFICIENT_TRANSFERABLE(ErrorCategory.ELIGIBILITY),
    INSUFFICIENT_ALLOWANCE(ErrorCategory.ELIGIBILITY),
    DURATION_NOT_MET(ErrorCategory.ELIGIBILITY),
    NOT_ELIGIBLE(ErrorCategory.ELIGIBILITY),

    // state
    ROUND_NOT_OPEN(ErrorCategory.STATE),
    ROUND_NOT_ENDED(ErrorCategory.STATE),
    ROUND_ALREADY_DRAWN(ErrorCategory.STATE),
    DRAW_ALREADY_REQUESTED(ErrorCategory.STATE),
    EMERGENCY_DRAW_TOO_EARLY(ErrorCategory.STATE),
    NUMBERS_NOT_DRAWN(ErrorCategory.STATE),
    ALREADY_CLAIMED(ErrorCategory.STATE),
    NO_WINNINGS(ErrorCategory.STATE),
    GIFTS_ALREADY_DISTRIBUTED(ErrorCategory.STATE),
    INVALID_REQUEST(ErrorCategory.STATE),
    EMERGENCY_MODE_DISABLED(ErrorCategory.STATE),
    OPERATION_NOT_SCHEDULED(ErrorCategory.STATE),
    OPERATION_ALREADY_SCHEDULED(ErrorCategory.STATE),
    TIMELOCK_NOT_READY(ErrorCategory.STATE),
    ENGINE_PAUSED(ErrorCategory.STATE),
    REENTRANT_CALL(ErrorCategory.STATE),

    // capacity
    EXCEEDS_MAXIMUM(ErrorCategory.CAPACITY),
    EXCEEDS_MAX_BET(ErrorCategory.CAPACITY),
    EXCEEDS_MAX_SUPPLY(ErrorCategory.CAPACITY),
    PAYOUT_EXCEEDS_MAXIMUM(ErrorCategory.CAPACITY),
    INSUFFICIENT_RESERVE(ErrorCategory.CAPACITY),
    ARITHMETIC_OVERFLOW(ErrorCategory.CAPACITY),
    ARITHMETIC_UNDERFLOW(ErrorCategory.CAPACITY),

    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),

    ROUND_NOT_FOUND(ErrorCategory.NOT_FOUND),
    BET_NOT_FOUND(ErrorCategory.NOT_FOUND);

    private final ErrorCategory category;
}
