package com.bridgestats.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point valuation of raw token amounts.
 * <p>
 * Prices are integers scaled by {@link #PRICE_PRECISION} (10^8). Token precision is the number of decimal
 * digits of the raw amount. Stored USD/BTC values are integers scaled by {@link #STORAGE_SCALE} and
 * truncated toward zero. Intermediates are exact; the final truncation is the only rounding step.
 */
public final class Valuation {

    public static final int PRICE_DECIMALS = 8;
    public static final BigInteger PRICE_PRECISION = BigInteger.TEN.pow(PRICE_DECIMALS);

    public static final int STORAGE_DECIMALS = 4;
    public static final BigInteger STORAGE_SCALE = BigInteger.TEN.pow(STORAGE_DECIMALS);

    private Valuation() {
    }

    /**
     * USD value scaled by {@link #STORAGE_SCALE}: amount / 10^decimals * price / 10^8 * 10^4.
     */
    public static BigInteger toUsd(BigInteger amount, int decimals, long price) {
        return toUsd(new BigDecimal(amount), decimals, price);
    }

    /**
     * As {@link #toUsd(BigInteger, int, long)} for amounts already normalized to a basic's precision,
     * which may carry a fractional part.
     */
    public static BigInteger toUsd(BigDecimal amount, int decimals, long price) {
        requireDecimals(decimals);
        return amount.multiply(BigDecimal.valueOf(price))
                .movePointLeft(decimals + PRICE_DECIMALS - STORAGE_DECIMALS)
                .setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact();
    }

    /**
     * BTC value scaled by {@link #STORAGE_SCALE}. Both prices share the same scale, so it cancels.
     */
    public static BigInteger toBtc(BigInteger amount, int decimals, long price, long btcPrice) {
        return toBtc(new BigDecimal(amount), decimals, price, btcPrice);
    }

    public static BigInteger toBtc(BigDecimal amount, int decimals, long price, long btcPrice) {
        requireDecimals(decimals);
        if (btcPrice <= 0) {
            throw new IllegalArgumentException("BTC price must be positive, got " + btcPrice);
        }
        BigDecimal numerator = amount.multiply(BigDecimal.valueOf(price)).movePointRight(STORAGE_DECIMALS);
        BigDecimal denominator = BigDecimal.valueOf(btcPrice).movePointRight(decimals);
        return numerator.divide(denominator, 0, RoundingMode.DOWN).toBigIntegerExact();
    }

    /**
     * Exact USD value, unscaled. Division is by powers of ten only, so nothing is rounded.
     */
    public static BigDecimal usdValue(BigInteger amount, int decimals, long price) {
        return usdValue(new BigDecimal(amount), decimals, price);
    }

    public static BigDecimal usdValue(BigDecimal amount, int decimals, long price) {
        requireDecimals(decimals);
        return amount.multiply(BigDecimal.valueOf(price)).movePointLeft(decimals + PRICE_DECIMALS);
    }

    /**
     * Inverse of {@link #toUsd(BigInteger, int, long)}: the raw amount worth {@code usdScaled} at
     * {@code price}, truncated toward zero.
     */
    public static BigInteger amountFromUsd(BigInteger usdScaled, int decimals, long price) {
        requireDecimals(decimals);
        if (price <= 0) {
            throw new IllegalArgumentException("price must be positive, got " + price);
        }
        BigInteger numerator = usdScaled.multiply(BigInteger.TEN.pow(decimals)).multiply(PRICE_PRECISION);
        BigInteger denominator = BigInteger.valueOf(price).multiply(STORAGE_SCALE);
        return numerator.divide(denominator);
    }

    /**
     * Largest raw-amount error a {@link #toUsd} then {@link #amountFromUsd} round trip can introduce.
     */
    public static BigInteger roundTripTolerance(int decimals, long price) {
        requireDecimals(decimals);
        BigInteger numerator = BigInteger.TEN.pow(decimals).multiply(PRICE_PRECISION);
        BigInteger denominator = BigInteger.valueOf(price).multiply(STORAGE_SCALE);
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), 0, RoundingMode.CEILING)
                .toBigIntegerExact()
                .add(BigInteger.ONE);
    }

    /**
     * Re-expresses a raw amount from {@code fromDecimals} to {@code toDecimals} without rounding.
     */
    public static BigDecimal rescale(BigInteger amount, int fromDecimals, int toDecimals) {
        requireDecimals(fromDecimals);
        requireDecimals(toDecimals);
        return new BigDecimal(amount).movePointRight(toDecimals - fromDecimals);
    }

    private static void requireDecimals(int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be non-negative, got " + decimals);
        }
    }
}
