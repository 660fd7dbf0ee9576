package com.bridgestats.stats.store;

import com.bridgestats.domain.AssetStatistic;
import com.bridgestats.domain.AssetStatisticRepository;
import com.bridgestats.domain.ChainStatistic;
import com.bridgestats.domain.ChainStatisticRepository;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.domain.TokenStatistic;
import com.bridgestats.domain.TokenStatisticRepository;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.LedgerStream;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Statistic rows in MongoDB. Whole-row saves go through the repositories and are guarded by the
 * row's {@code @Version}; single-field updates bump the version so a concurrent whole-row save fails
 * instead of overwriting them.
 */
@Repository
@RequiredArgsConstructor
public class MongoStatisticStore implements StatisticStore {

    private final TokenStatisticRepository tokenStatisticRepository;
    private final ChainStatisticRepository chainStatisticRepository;
    private final AssetStatisticRepository assetStatisticRepository;
    private final MongoTemplate mongoTemplate;
    private final LedgerReader ledgerReader;

    @Override
    public long highestObservedId(LedgerStream stream) {
        return ledgerReader.highestId(stream);
    }

    @Override
    public List<TokenStatistic> loadTokenStatistics() {
        return tokenStatisticRepository.findAll();
    }

    @Override
    public List<ChainStatistic> loadChainStatistics() {
        return chainStatisticRepository.findAll();
    }

    @Override
    public List<AssetStatistic> loadAssetStatistics() {
        return assetStatisticRepository.findAll();
    }

    @Override
    public TokenStatistic save(TokenStatistic row) {
        return tokenStatisticRepository.save(row);
    }

    @Override
    public ChainStatistic save(ChainStatistic row) {
        return chainStatisticRepository.save(row);
    }

    @Override
    public AssetStatistic save(AssetStatistic row) {
        return assetStatisticRepository.save(row);
    }

    @Override
    public boolean updateChainAddresses(long chainId, long addresses) {
        Query query = new Query(where("chainId").is(chainId));
        Update update = new Update().set("addresses", addresses).inc("version", 1);
        return mongoTemplate.updateFirst(query, update, ChainStatistic.class).getMatchedCount() > 0;
    }

    @Override
    public boolean updateAssetAddresses(String basicName, long addresses) {
        Query query = new Query(where("basicName").is(basicName));
        Update update = new Update().set("addresses", addresses).inc("version", 1);
        return mongoTemplate.updateFirst(query, update, AssetStatistic.class).getMatchedCount() > 0;
    }

    @Override
    public boolean advanceTokenBasicTotals(String basicName, long expectedCheckpoint, long newCheckpoint,
                                           BigDecimal totalAmount, long totalCount) {
        Query query = new Query(where("_id").is(basicName).and("statsCheckpoint").is(expectedCheckpoint));
        Update update = new Update()
                .set("statsCheckpoint", newCheckpoint)
                .set("totalAmount", totalAmount)
                .set("totalCount", totalCount);
        return mongoTemplate.updateFirst(query, update, TokenBasic.class).getModifiedCount() > 0;
    }

    @Override
    public void updateTokenAvailableAmount(long chainId, String hash, BigDecimal amount) {
        Query query = new Query(where("chainId").is(chainId).and("hash").is(hash));
        mongoTemplate.updateFirst(query, new Update().set("availableAmount", amount), Token.class);
    }
}
