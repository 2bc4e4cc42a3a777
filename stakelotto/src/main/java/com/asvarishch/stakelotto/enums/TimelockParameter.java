package com.asvarishch.stakelotto.enums;

/**
 * Parameters that may only change through schedule -> delay -> execute.
 */
public enum TimelockParameter {
    MAX_PAYOUT_PER_ROUND,
    GIFT_CREATOR_AMOUNT,
    GIFT_USER_AMOUNT,
    /** Value must be a whole number. */
    GIFT_RECIPIENTS_PER_ROUND
}
