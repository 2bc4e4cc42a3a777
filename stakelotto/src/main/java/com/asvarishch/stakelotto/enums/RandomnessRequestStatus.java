package com.asvarishch.stakelotto.enums;

public enum RandomnessRequestStatus {
    REQUESTED,
    FULFILLED
}
