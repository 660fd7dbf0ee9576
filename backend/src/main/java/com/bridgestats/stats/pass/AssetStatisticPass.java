package com.bridgestats.stats.pass;

import com.bridgestats.common.Valuation;
import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.AssetStatistic;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.ledger.AmountCount;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.LedgerStream;
import com.bridgestats.ledger.TokenCatalog;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.engine.StatsProperties;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Outbound volume per token basic. Source transfers are grouped by (chain, asset), mapped to their
 * basic through the token catalog and rescaled to the basic's precision before they are summed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AssetStatisticPass implements ScheduledPass {

    public static final String NAME = "asset-statistic";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;
    private final StatsProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        long newId = store.highestObservedId(LedgerStream.SRC_TRANSFER);
        TokenCatalog catalog = TokenCatalog.load(ledgerReader);
        List<AssetStatistic> rows = withCatalogRows(store.loadAssetStatistics(), catalog);
        List<AssetStatistic> tracked = new ArrayList<>();
        for (AssetStatistic row : rows) {
            if (catalog.basic(row.getBasicName()).isPresent()) {
                tracked.add(row);
            } else {
                log.warn("Pass {}: asset statistic {} has no token basic, left stale", NAME, row.getBasicName());
            }
        }

        Map<Long, Map<String, BasicDelta>> deltas = CheckpointDeltas.prefetch(
                tracked.stream().map(AssetStatistic::getLastCheckId).toList(), newId,
                from -> byBasic(ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, from, newId), catalog));

        OptionalLong btcPrice = catalog.priceOf(properties.getBtcBasicName());
        int saved = 0;
        int failed = 0;
        for (AssetStatistic row : tracked) {
            TokenBasic basic = catalog.basic(row.getBasicName()).orElseThrow();
            boolean changed = row.getId() == null;
            Map<String, BasicDelta> delta = deltas.get(row.getLastCheckId());
            if (delta != null) {
                BasicDelta d = delta.getOrDefault(row.getBasicName(), BasicDelta.ZERO);
                row.setAmount(row.getAmount().add(d.amount()));
                row.setTxCount(row.getTxCount() + d.count());
                row.setLastCheckId(newId);
                changed = true;
            }
            changed |= revalue(row, basic, btcPrice);
            if (!changed) {
                continue;
            }
            try {
                store.save(row);
                saved++;
            } catch (DataAccessException e) {
                failed++;
                log.warn("Pass {}: failed to save asset statistic {}, retried next tick: {}",
                        NAME, row.getBasicName(), e.getMessage());
            }
        }
        log.info("Pass {}: up to {}; saved {}, stale {}, failed {} of {} rows",
                NAME, newId, saved, rows.size() - tracked.size(), failed, rows.size());
    }

    private static Map<String, BasicDelta> byBasic(Map<AssetKey, AmountCount> perAsset, TokenCatalog catalog) {
        Map<String, BasicDelta> result = new HashMap<>();
        perAsset.forEach((key, delta) -> {
            Token token = catalog.token(key).orElse(null);
            TokenBasic basic = token == null ? null : catalog.basic(token.getTokenBasicName()).orElse(null);
            if (basic == null) {
                log.debug("Pass {}: {} transfers of uncatalogued asset {}:{} not attributed",
                        NAME, delta.count(), key.chainId(), key.hash());
                return;
            }
            BigDecimal amount = Valuation.rescale(delta.amount(), token.getPrecision(), basic.getPrecision());
            result.merge(basic.getName(), new BasicDelta(amount, delta.count()), BasicDelta::plus);
        });
        return result;
    }

    private static boolean revalue(AssetStatistic row, TokenBasic basic, OptionalLong btcPrice) {
        BigDecimal usd = new BigDecimal(Valuation.toUsd(row.getAmount(), basic.getPrecision(), basic.getPrice()));
        boolean changed = CheckpointDeltas.differs(row.getAmountUsd(), usd);
        row.setAmountUsd(usd);
        if (btcPrice.isPresent()) {
            BigDecimal btc = new BigDecimal(Valuation.toBtc(row.getAmount(), basic.getPrecision(),
                    basic.getPrice(), btcPrice.getAsLong()));
            changed |= CheckpointDeltas.differs(row.getAmountBtc(), btc);
            row.setAmountBtc(btc);
        }
        return changed;
    }

    private static List<AssetStatistic> withCatalogRows(List<AssetStatistic> existing, TokenCatalog catalog) {
        List<AssetStatistic> rows = new ArrayList<>(existing);
        Set<String> known = new HashSet<>();
        existing.forEach(r -> known.add(r.getBasicName()));
        for (TokenBasic basic : catalog.basics()) {
            if (known.add(basic.getName())) {
                rows.add(AssetStatistic.empty(basic.getName()));
                log.info("Pass {}: created asset statistic row for {}", NAME, basic.getName());
            }
        }
        return rows;
    }

    record BasicDelta(BigDecimal amount, long count) {

        static final BasicDelta ZERO = new BasicDelta(BigDecimal.ZERO, 0);

        BasicDelta plus(BasicDelta other) {
            return new BasicDelta(amount.add(other.amount), count + other.count);
        }
    }
}
