package com.bridgestats.reserve;

import java.math.BigInteger;

/**
 * Reserve figures of one chain entry. {@code flow} is supply not backed by custody on that chain.
 * Synthetic entries stand for custody fetched from an external lookup and carry only a flow.
 */
public record ChainReserve(long chainId, String hash, BigInteger totalSupply, BigInteger balance,
                           BigInteger flow, boolean synthetic) {

    public static ChainReserve of(long chainId, String hash, BigInteger totalSupply, BigInteger balance) {
        return new ChainReserve(chainId, hash, totalSupply, balance, totalSupply.subtract(balance), false);
    }

    public static ChainReserve external(long chainId, BigInteger balance) {
        return new ChainReserve(chainId, null, BigInteger.ZERO, BigInteger.ZERO, balance, true);
    }
}
