package com.bridgestats.stats.store;

import com.bridgestats.domain.AssetStatistic;
import com.bridgestats.domain.ChainStatistic;
import com.bridgestats.domain.TokenStatistic;
import com.bridgestats.ledger.LedgerStream;

import java.math.BigDecimal;
import java.util.List;

/**
 * Durable home of (checkpoint, accumulated totals) rows. Every write covers one row and is atomic;
 * a row's checkpoint and its totals always travel in the same write.
 */
public interface StatisticStore {

    /** High-water mark of a ledger stream; the upper bound of the next delta range. */
    long highestObservedId(LedgerStream stream);

    List<TokenStatistic> loadTokenStatistics();

    List<ChainStatistic> loadChainStatistics();

    List<AssetStatistic> loadAssetStatistics();

    TokenStatistic save(TokenStatistic row);

    ChainStatistic save(ChainStatistic row);

    AssetStatistic save(AssetStatistic row);

    /** Sets only the address count of a chain row. Returns false when the row does not exist. */
    boolean updateChainAddresses(long chainId, long addresses);

    /** Sets only the address count of an asset row. Returns false when the row does not exist. */
    boolean updateAssetAddresses(String basicName, long addresses);

    /**
     * Advances the volume totals of a token basic only if its checkpoint still equals {@code expectedCheckpoint}.
     *
     * @return false when another writer moved the checkpoint first
     */
    boolean advanceTokenBasicTotals(String basicName, long expectedCheckpoint, long newCheckpoint,
                                    BigDecimal totalAmount, long totalCount);

    /** Records the latest live balance of a chain-specific token. */
    void updateTokenAvailableAmount(long chainId, String hash, BigDecimal amount);
}
