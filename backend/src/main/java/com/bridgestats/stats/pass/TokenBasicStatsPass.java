package com.bridgestats.stats.pass;

import com.bridgestats.common.Valuation;
import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.ledger.AmountCount;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.LedgerStream;
import com.bridgestats.ledger.TokenCatalog;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Volume totals kept on the token basic itself ({@code totalAmount}, {@code totalCount}). The basic
 * document also carries price and catalog fields owned by other writers, so totals are advanced with a
 * compare-and-set on {@code statsCheckpoint} instead of a whole-document save.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenBasicStatsPass implements ScheduledPass {

    public static final String NAME = "token-basic";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        long newId = store.highestObservedId(LedgerStream.SRC_TRANSFER);
        TokenCatalog catalog = TokenCatalog.load(ledgerReader);
        List<TokenBasic> basics = List.copyOf(catalog.basics());
        Map<Long, Map<AssetKey, AmountCount>> deltas = CheckpointDeltas.prefetch(
                basics.stream().map(TokenBasic::getStatsCheckpoint).toList(), newId,
                from -> ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, from, newId));

        int advanced = 0;
        int conflicts = 0;
        for (TokenBasic basic : basics) {
            Map<AssetKey, AmountCount> delta = deltas.get(basic.getStatsCheckpoint());
            if (delta == null) {
                continue;
            }
            BigDecimal amount = BigDecimal.ZERO;
            long count = 0;
            for (Token token : catalog.tokens()) {
                if (!basic.getName().equals(token.getTokenBasicName())) {
                    continue;
                }
                AmountCount d = delta.getOrDefault(token.key(), AmountCount.ZERO);
                amount = amount.add(Valuation.rescale(d.amount(), token.getPrecision(), basic.getPrecision()));
                count += d.count();
            }
            BigDecimal previous = basic.getTotalAmount() == null ? BigDecimal.ZERO : basic.getTotalAmount();
            try {
                if (store.advanceTokenBasicTotals(basic.getName(), basic.getStatsCheckpoint(), newId,
                        previous.add(amount), basic.getTotalCount() + count)) {
                    advanced++;
                } else {
                    conflicts++;
                    log.warn("Pass {}: checkpoint of {} moved since it was read, skipped until next tick",
                            NAME, basic.getName());
                }
            } catch (DataAccessException e) {
                log.warn("Pass {}: failed to advance totals of {}: {}", NAME, basic.getName(), e.getMessage());
            }
        }
        log.info("Pass {}: up to {}; advanced {}, conflicts {} of {} basics",
                NAME, newId, advanced, conflicts, basics.size());
    }
}
