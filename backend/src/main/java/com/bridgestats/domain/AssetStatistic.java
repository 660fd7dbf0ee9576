package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Outbound volume per token basic, checkpointed against src_transfers.
 * {@code amount} is in the basic's canonical precision.
 */
@Document(collection = "asset_statistics")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AssetStatistic {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String basicName;
    private BigDecimal amount = BigDecimal.ZERO;
    private long txCount;
    private long addresses;
    private BigDecimal amountUsd = BigDecimal.ZERO;
    private BigDecimal amountBtc = BigDecimal.ZERO;
    private long lastCheckId;
    @Version
    private Long version;

    public static AssetStatistic empty(String basicName) {
        AssetStatistic s = new AssetStatistic();
        s.setBasicName(basicName);
        return s;
    }
}
