package com.bridgestats.stats.pass;

import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.chain.RpcException;
import com.bridgestats.common.Valuation;
import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.domain.TokenStatistic;
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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Folds inbound (dst_transfers) and outbound (src_transfers) volume into one row per chain-specific token.
 * <p>
 * Each row is brought forward from its own checkpoints to the current high-water marks and saved on its own,
 * so a failed save leaves that row to be retried from the same range on the next tick. On the token's home
 * chain the inbound amount is the live custody balance rather than the ledger sum.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenStatisticPass implements ScheduledPass {

    public static final String NAME = "token-statistic";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;
    private final ChainDataClient chainDataClient;
    private final StatsProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        long newInId = store.highestObservedId(LedgerStream.DST_TRANSFER);
        long newOutId = store.highestObservedId(LedgerStream.SRC_TRANSFER);
        TokenCatalog catalog = TokenCatalog.load(ledgerReader);
        List<TokenStatistic> rows = withCatalogRows(store.loadTokenStatistics(), catalog);
        List<TrackedRow> tracked = new ArrayList<>();
        for (TokenStatistic row : rows) {
            Token token = catalog.token(row.key()).orElse(null);
            TokenBasic basic = token == null ? null : catalog.basic(token.getTokenBasicName()).orElse(null);
            if (basic == null) {
                log.warn("Pass {}: token statistic {}:{} has no catalog entry, left stale",
                        NAME, row.getChainId(), row.getHash());
            } else {
                tracked.add(new TrackedRow(row, token, basic));
            }
        }

        Map<Long, Map<AssetKey, AmountCount>> inDeltas = CheckpointDeltas.prefetch(
                tracked.stream().map(t -> t.row().getLastInCheckId()).toList(), newInId,
                from -> ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, from, newInId));
        Map<Long, Map<AssetKey, AmountCount>> outDeltas = CheckpointDeltas.prefetch(
                tracked.stream().map(t -> t.row().getLastOutCheckId()).toList(), newOutId,
                from -> ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, from, newOutId));

        OptionalLong btcPrice = catalog.priceOf(properties.getBtcBasicName());
        if (btcPrice.isEmpty()) {
            log.warn("Pass {}: no price for {}, BTC valuations left unchanged", NAME, properties.getBtcBasicName());
        }

        int saved = 0;
        int failed = 0;
        for (TrackedRow t : tracked) {
            TokenStatistic row = t.row();
            boolean changed = row.getId() == null;
            changed |= foldIn(row, inDeltas.get(row.getLastInCheckId()), newInId, t.basic().getChainId());
            changed |= foldOut(row, outDeltas.get(row.getLastOutCheckId()), newOutId);
            changed |= revalue(row, t.token().getPrecision(), t.basic().getPrice(), btcPrice);
            if (!changed) {
                continue;
            }
            try {
                store.save(row);
                saved++;
            } catch (DataAccessException e) {
                failed++;
                log.warn("Pass {}: failed to save token statistic {}:{}, retried next tick: {}",
                        NAME, row.getChainId(), row.getHash(), e.getMessage());
            }
        }
        log.info("Pass {}: in up to {}, out up to {}; saved {}, stale {}, failed {} of {} rows",
                NAME, newInId, newOutId, saved, rows.size() - tracked.size(), failed, rows.size());
    }

    private boolean foldIn(TokenStatistic row, Map<AssetKey, AmountCount> deltas, long newInId, long homeChainId) {
        boolean changed = false;
        if (deltas != null) {
            AmountCount delta = deltas.getOrDefault(row.key(), AmountCount.ZERO);
            row.setInCounter(row.getInCounter() + delta.count());
            if (row.getChainId() != homeChainId) {
                row.setInAmount(row.getInAmount().add(new BigDecimal(delta.amount())));
            }
            row.setLastInCheckId(newInId);
            changed = true;
        }
        if (row.getChainId() == homeChainId) {
            changed |= refreshCustodyBalance(row);
        }
        return changed;
    }

    private boolean foldOut(TokenStatistic row, Map<AssetKey, AmountCount> deltas, long newOutId) {
        if (deltas == null) {
            return false;
        }
        AmountCount delta = deltas.getOrDefault(row.key(), AmountCount.ZERO);
        row.setOutCounter(row.getOutCounter() + delta.count());
        row.setOutAmount(row.getOutAmount().add(new BigDecimal(delta.amount())));
        row.setLastOutCheckId(newOutId);
        return true;
    }

    private boolean refreshCustodyBalance(TokenStatistic row) {
        try {
            BigDecimal balance = new BigDecimal(chainDataClient.getBalance(row.getChainId(), row.getHash()));
            if (CheckpointDeltas.differs(row.getInAmount(), balance)) {
                row.setInAmount(balance);
                return true;
            }
            return false;
        } catch (RpcException e) {
            log.warn("Pass {}: home-chain balance of {}:{} unavailable, keeping {}: {}",
                    NAME, row.getChainId(), row.getHash(), row.getInAmount(), e.getMessage());
            return false;
        }
    }

    private static boolean revalue(TokenStatistic row, int precision, long price, OptionalLong btcPrice) {
        BigDecimal inUsd = new BigDecimal(Valuation.toUsd(row.getInAmount(), precision, price));
        BigDecimal outUsd = new BigDecimal(Valuation.toUsd(row.getOutAmount(), precision, price));
        boolean changed = CheckpointDeltas.differs(row.getInAmountUsd(), inUsd)
                || CheckpointDeltas.differs(row.getOutAmountUsd(), outUsd);
        row.setInAmountUsd(inUsd);
        row.setOutAmountUsd(outUsd);
        if (btcPrice.isPresent()) {
            BigDecimal inBtc = new BigDecimal(Valuation.toBtc(row.getInAmount(), precision, price, btcPrice.getAsLong()));
            BigDecimal outBtc = new BigDecimal(Valuation.toBtc(row.getOutAmount(), precision, price, btcPrice.getAsLong()));
            changed |= CheckpointDeltas.differs(row.getInAmountBtc(), inBtc)
                    || CheckpointDeltas.differs(row.getOutAmountBtc(), outBtc);
            row.setInAmountBtc(inBtc);
            row.setOutAmountBtc(outBtc);
        }
        return changed;
    }

    private static List<TokenStatistic> withCatalogRows(List<TokenStatistic> existing, TokenCatalog catalog) {
        List<TokenStatistic> rows = new ArrayList<>(existing);
        Set<AssetKey> known = new HashSet<>();
        existing.forEach(r -> known.add(r.key()));
        int created = 0;
        for (Token token : catalog.tokens()) {
            if (known.add(token.key())) {
                rows.add(TokenStatistic.empty(token.getChainId(), token.getHash()));
                created++;
            }
        }
        if (created > 0) {
            log.info("Pass {}: created {} token statistic rows for newly catalogued tokens", NAME, created);
        }
        return rows;
    }

    private record TrackedRow(TokenStatistic row, Token token, TokenBasic basic) {
    }
}
