package com.bridgestats.chain;

import java.math.BigInteger;

/**
 * Live token figures on a chain. Both calls throw {@link RpcException} on failure; callers own retries.
 */
public interface ChainDataClient {

    /** Raw amount of {@code assetHash} held by the bridge custody contract on {@code chainId}. */
    BigInteger getBalance(long chainId, String assetHash);

    /** Raw total supply of {@code assetHash} on {@code chainId}. */
    BigInteger getTotalSupply(long chainId, String assetHash);
}
