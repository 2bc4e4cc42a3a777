package com.asvarishch.stakelotto.dto;

import java.math.BigInteger;
import java.util.List;

public record RandomnessFulfillmentMessage(
        Long requestId,
        List<BigInteger> values
) {}
