package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Transfer counts and active addresses per chain. For the relay chain both checkpoints track the
 * relay stream; for every other chain they track dst_transfers (in) and src_transfers (out).
 */
@Document(collection = "chain_statistics")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainStatistic {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private long chainId;
    private long in;
    private long out;
    private long addresses;
    private long lastInCheckId;
    private long lastOutCheckId;
    @Version
    private Long version;

    public static ChainStatistic empty(long chainId) {
        ChainStatistic s = new ChainStatistic();
        s.setChainId(chainId);
        return s;
    }
}
