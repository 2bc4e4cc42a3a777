package com.asvarishch.stakelotto.enums;

public enum Role {
    OWNER,
    OPERATOR,
    DISTRIBUTOR,
    ADMIN
}
