package com.asvarishch.stakelotto.exception;

/**
 * Coarse classification of every rejected call. None of them leaves partial state behind.
 */
public enum ErrorCategory {
    /** Malformed input; resubmit corrected input. */
    VALIDATION,
    /** Caller lacks stake, balance or duration; recoverable after the prerequisite action. */
    ELIGIBILITY,
    /** Protocol ordering violation (wrong phase, replay, double claim). */
    STATE,
    /** A shared limit would be exceeded. */
    CAPACITY,
    AUTHORIZATION,
    NOT_FOUND
}
