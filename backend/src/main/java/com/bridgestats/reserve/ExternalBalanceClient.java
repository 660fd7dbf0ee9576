package com.bridgestats.reserve;

import java.math.BigInteger;

/**
 * Custody balance reported by an endpoint outside the tracked chains.
 */
public interface ExternalBalanceClient {

    /**
     * @throws ExternalLookupException on transport errors, non-2xx answers or a body without a balance
     */
    BigInteger fetchBalance(String url);
}
