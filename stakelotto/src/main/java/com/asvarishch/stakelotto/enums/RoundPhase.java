package com.asvarishch.stakelotto.enums;

/**
 * OPEN -> CLOSED -> AWAITING_DRAW -> DRAWN.
 * CLOSED is never stored; it is an OPEN round whose end time has passed.
 */
public enum RoundPhase {
    OPEN,
    CLOSED,
    AWAITING_DRAW,
    DRAWN
}
