package com.asvarishch.stakelotto.util;

import com.asvarishch.stakelotto.exception.LotteryException;

public final class Addresses {

    public static final int MAX_LENGTH = 64;

    private Addresses() {
    }

    public static String require(String address) {
        if (address == null || address.isBlank() || address.length() > MAX_LENGTH || !address.equals(address.trim())) {
            throw LotteryException.invalidAddress(address);
        }
        return address;
    }
}
