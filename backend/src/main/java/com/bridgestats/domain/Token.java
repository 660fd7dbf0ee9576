package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Chain-specific deployment of a {@link TokenBasic}: (chainId, hash) with its own precision.
 */
@Document(collection = "tokens")
@CompoundIndex(name = "chain_hash", def = "{'chainId': 1, 'hash': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Token {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private String hash;
    private String tokenBasicName;
    private int precision;
    /** 0 = fungible. */
    private int standard;
    /** 1 = included in reserve reconciliation. */
    private int property;
    /** Latest live balance held by the bridge on this chain. */
    private BigDecimal availableAmount;

    public boolean isReserveRelevant() {
        return property == TokenBasic.PROPERTY_RESERVE_TRACKED;
    }

    public AssetKey key() {
        return new AssetKey(chainId, hash);
    }
}
