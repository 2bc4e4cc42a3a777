package com.asvarishch.stakelotto.util;

import com.asvarishch.stakelotto.exception.LotteryException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Checked arithmetic for token amounts: unsigned fixed-point with 18 fractional digits,
 * stored as NUMERIC(38,18). Results never wrap, never go negative and never outgrow the column.
 */
public final class TokenMath {

    public static final int SCALE = 18;
    public static final int PRECISION = 38;

    /** Smallest representable amount (10^-18 tokens). */
    public static final BigDecimal ONE_UNIT = BigDecimal.ONE.movePointLeft(SCALE);

    /** Largest amount the storage column holds. */
    public static final BigDecimal MAX_AMOUNT = BigDecimal.TEN.pow(PRECISION - SCALE).subtract(ONE_UNIT);

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private TokenMath() {
    }

    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount must not be null");
        }
        if (amount.signum() < 0) {
            throw LotteryException.arithmeticUnderflow("negative amount " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw LotteryException.invalidParameterValue("Amount " + amount.toPlainString() + " has more than " + SCALE + " decimals");
        }
        BigDecimal scaled = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        if (scaled.compareTo(MAX_AMOUNT) > 0) {
            throw LotteryException.arithmeticOverflow(amount.toPlainString() + " exceeds " + MAX_AMOUNT.toPlainString());
        }
        return scaled;
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        BigDecimal sum = a.add(b);
        if (sum.compareTo(MAX_AMOUNT) > 0) {
            throw LotteryException.arithmeticOverflow(a.toPlainString() + " + " + b.toPlainString());
        }
        return sum.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal subtract(BigDecimal a, BigDecimal b) {
        BigDecimal diff = a.subtract(b);
        if (diff.signum() < 0) {
            throw LotteryException.arithmeticUnderflow(a.toPlainString() + " - " + b.toPlainString());
        }
        return diff.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /** amount * numerator / denominator, truncated to 18 decimals. */
    public static BigDecimal mulDiv(BigDecimal amount, long numerator, long denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator must be positive");
        }
        BigDecimal result = amount.multiply(BigDecimal.valueOf(numerator))
                .divide(BigDecimal.valueOf(denominator), SCALE, RoundingMode.DOWN);
        if (result.compareTo(MAX_AMOUNT) > 0) {
            throw LotteryException.arithmeticOverflow(amount.toPlainString() + " * " + numerator + " / " + denominator);
        }
        return result;
    }

    public static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }
}
