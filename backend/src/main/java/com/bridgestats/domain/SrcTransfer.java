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
 * Token transfer observed on the source chain. Append-only; {@code id} increases monotonically and is the
 * checkpoint cursor for outbound statistics.
 */
@Document(collection = "src_transfers")
@CompoundIndex(name = "chain_asset", def = "{'chainId': 1, 'asset': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SrcTransfer {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String txHash;
    private long chainId;
    private String asset;
    private String from;
    private String to;
    /** Raw integer amount in the token's smallest unit (scale 0). */
    private BigDecimal amount;
    private long dstChainId;
    private long time;
}
