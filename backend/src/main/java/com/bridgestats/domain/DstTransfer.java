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
 * Token transfer executed on the destination chain. Cursor for inbound statistics.
 */
@Document(collection = "dst_transfers")
@CompoundIndex(name = "chain_asset", def = "{'chainId': 1, 'asset': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DstTransfer {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String txHash;
    private long chainId;
    private String asset;
    private String from;
    private String to;
    private BigDecimal amount;
    private long srcChainId;
    private long time;
}
