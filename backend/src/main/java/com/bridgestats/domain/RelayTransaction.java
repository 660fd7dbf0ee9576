package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Relay-chain transaction linking a source transfer to its destination transfer by hash.
 */
@Document(collection = "poly_transactions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RelayTransaction {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String hash;
    private String srcHash;
    private String dstHash;
    private long srcChainId;
    private long dstChainId;
    private long time;
}
