package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Accumulated inbound/outbound volume per (chainId, hash). Totals and checkpoints are written in one save.
 * USD and BTC values are derived from the cumulative amounts, scaled by 10^4.
 */
@Document(collection = "token_statistics")
@CompoundIndex(name = "chain_hash", def = "{'chainId': 1, 'hash': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenStatistic {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String hash;
    private BigDecimal inAmount = BigDecimal.ZERO;
    private BigDecimal outAmount = BigDecimal.ZERO;
    private long inCounter;
    private long outCounter;
    private BigDecimal inAmountUsd = BigDecimal.ZERO;
    private BigDecimal outAmountUsd = BigDecimal.ZERO;
    private BigDecimal inAmountBtc = BigDecimal.ZERO;
    private BigDecimal outAmountBtc = BigDecimal.ZERO;
    /** Highest dst_transfers id folded into the inbound totals. */
    private long lastInCheckId;
    /** Highest src_transfers id folded into the outbound totals. */
    private long lastOutCheckId;
    @Version
    private Long version;

    public static TokenStatistic empty(long chainId, String hash) {
        TokenStatistic s = new TokenStatistic();
        s.setChainId(chainId);
        s.setHash(hash);
        return s;
    }

    public AssetKey key() {
        return new AssetKey(chainId, hash);
    }
}
