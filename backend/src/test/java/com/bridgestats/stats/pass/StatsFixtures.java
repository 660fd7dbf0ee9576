package com.bridgestats.stats.pass;

import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;

final class StatsFixtures {

    static final long ETHEREUM = 2;
    static final long BSC = 6;
    static final long HECO = 7;

    /** $1.00 scaled by 10^8. */
    static final long USD_1 = 1_00000000L;
    /** $30,000.00 scaled by 10^8. */
    static final long USD_30K = 30_000_00000000L;

    private StatsFixtures() {
    }

    static TokenBasic basic(String name, long homeChainId, int precision, long price) {
        TokenBasic b = new TokenBasic();
        b.setName(name);
        b.setChainId(homeChainId);
        b.setPrecision(precision);
        b.setPrice(price);
        return b;
    }

    static Token token(long chainId, String hash, String basicName, int precision) {
        Token t = new Token();
        t.setId(chainId + ":" + hash);
        t.setChainId(chainId);
        t.setHash(hash);
        t.setTokenBasicName(basicName);
        t.setPrecision(precision);
        return t;
    }
}
