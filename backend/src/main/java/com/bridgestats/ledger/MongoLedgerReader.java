package com.bridgestats.ledger;

import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.domain.TokenBasicRepository;
import com.bridgestats.domain.TokenRepository;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed ledger reader. Sums run server-side on Decimal128, so they stay exact.
 */
@Repository
@RequiredArgsConstructor
public class MongoLedgerReader implements LedgerReader {

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final TokenRepository tokenRepository;
    private final TokenBasicRepository tokenBasicRepository;

    @Override
    public long highestId(LedgerStream stream) {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, ID)).limit(1);
        query.fields().include(ID);
        Document last = mongoTemplate.findOne(query, Document.class, stream.collection());
        if (last == null || last.get(ID) == null) {
            return 0L;
        }
        return ((Number) last.get(ID)).longValue();
    }

    @Override
    public Map<AssetKey, AmountCount> sumAndCountByAsset(LedgerStream stream, long fromIdExclusive, long toIdInclusive) {
        requireTransferStream(stream);
        Map<AssetKey, AmountCount> result = new HashMap<>();
        if (toIdInclusive <= fromIdExclusive) {
            return result;
        }
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(range(fromIdExclusive, toIdInclusive)),
                Aggregation.group("chainId", "asset").sum("amount").as("amount").count().as("count"));
        for (Document row : mongoTemplate.aggregate(aggregation, stream.collection(), Document.class)) {
            Document id = row.get(ID, Document.class);
            AssetKey key = new AssetKey(((Number) id.get("chainId")).longValue(), id.getString("asset"));
            AmountCount value = new AmountCount(toBigInteger(row.get("amount")), ((Number) row.get("count")).longValue());
            result.merge(key, value, AmountCount::plus);
        }
        return result;
    }

    @Override
    public Map<Long, Long> countByChain(LedgerStream stream, long fromIdExclusive, long toIdInclusive) {
        requireTransferStream(stream);
        Map<Long, Long> result = new HashMap<>();
        if (toIdInclusive <= fromIdExclusive) {
            return result;
        }
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(range(fromIdExclusive, toIdInclusive)),
                Aggregation.group("chainId").count().as("count"));
        for (Document row : mongoTemplate.aggregate(aggregation, stream.collection(), Document.class)) {
            result.put(((Number) row.get(ID)).longValue(), ((Number) row.get("count")).longValue());
        }
        return result;
    }

    @Override
    public long countRelay(long fromIdExclusive, long toIdInclusive) {
        if (toIdInclusive <= fromIdExclusive) {
            return 0L;
        }
        return mongoTemplate.count(new Query(range(fromIdExclusive, toIdInclusive)), LedgerStream.RELAY.collection());
    }

    @Override
    public Map<Long, Set<String>> activeAddressesByChain() {
        Map<Long, Set<String>> result = new HashMap<>();
        collectDistinctByChain(LedgerStream.SRC_TRANSFER, "from", result);
        collectDistinctByChain(LedgerStream.DST_TRANSFER, "to", result);
        return result;
    }

    @Override
    public Map<AssetKey, Set<String>> senderAddressesByAsset() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("chainId", "asset").addToSet("from").as("addresses"));
        Map<AssetKey, Set<String>> result = new HashMap<>();
        for (Document row : mongoTemplate.aggregate(aggregation, LedgerStream.SRC_TRANSFER.collection(), Document.class)) {
            Document id = row.get(ID, Document.class);
            AssetKey key = new AssetKey(((Number) id.get("chainId")).longValue(), id.getString("asset"));
            result.computeIfAbsent(key, k -> new HashSet<>()).addAll(row.getList("addresses", String.class));
        }
        return result;
    }

    @Override
    public List<Token> listKnownAssets() {
        return tokenRepository.findAll();
    }

    @Override
    public List<Long> listKnownChains() {
        Set<Long> chains = new TreeSet<>();
        for (Token token : tokenRepository.findAll()) {
            chains.add(token.getChainId());
        }
        return new ArrayList<>(chains);
    }

    @Override
    public List<TokenBasic> listKnownBasics() {
        return tokenBasicRepository.findAll();
    }

    private void collectDistinctByChain(LedgerStream stream, String addressField, Map<Long, Set<String>> into) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("chainId").addToSet(addressField).as("addresses"));
        for (Document row : mongoTemplate.aggregate(aggregation, stream.collection(), Document.class)) {
            long chainId = ((Number) row.get(ID)).longValue();
            into.computeIfAbsent(chainId, k -> new HashSet<>()).addAll(row.getList("addresses", String.class));
        }
    }

    private static Criteria range(long fromIdExclusive, long toIdInclusive) {
        return where(ID).gt(fromIdExclusive).lte(toIdInclusive);
    }

    private static void requireTransferStream(LedgerStream stream) {
        if (!stream.isTransferStream()) {
            throw new IllegalArgumentException("Not a transfer stream: " + stream);
        }
    }

    static BigInteger toBigInteger(Object value) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        if (value instanceof Decimal128 d) {
            return d.bigDecimalValue().toBigIntegerExact();
        }
        if (value instanceof BigDecimal d) {
            return d.toBigIntegerExact();
        }
        if (value instanceof Number n) {
            return BigInteger.valueOf(n.longValue());
        }
        return new BigDecimal(value.toString()).toBigIntegerExact();
    }
}
