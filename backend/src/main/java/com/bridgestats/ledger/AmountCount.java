package com.bridgestats.ledger;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Summed raw amount and record count over a ledger id range.
 */
public record AmountCount(BigInteger amount, long count) {

    public static final AmountCount ZERO = new AmountCount(BigInteger.ZERO, 0);

    public AmountCount {
        Objects.requireNonNull(amount, "amount");
    }

    public AmountCount plus(AmountCount other) {
        return new AmountCount(amount.add(other.amount), count + other.count);
    }
}
