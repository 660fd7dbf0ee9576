package com.bridgestats.stats.pass;

import com.bridgestats.domain.ChainStatistic;
import com.bridgestats.domain.CrossChainId;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.LedgerStream;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.engine.StatsProperties;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transfer counts per chain: {@code in} from dst_transfers, {@code out} from src_transfers.
 * The relay chain row counts relay records instead, once into each direction, with both of its
 * checkpoints tracking the relay stream.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChainStatisticPass implements ScheduledPass {

    public static final String NAME = "chain-statistic";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;
    private final StatsProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        long relayChainId = properties.getRelayChainId();
        long newInId = store.highestObservedId(LedgerStream.DST_TRANSFER);
        long newOutId = store.highestObservedId(LedgerStream.SRC_TRANSFER);
        long newRelayId = store.highestObservedId(LedgerStream.RELAY);
        Set<Long> catalogued = new LinkedHashSet<>(ledgerReader.listKnownChains());
        catalogued.add(relayChainId);
        List<ChainStatistic> rows = withCatalogRows(store.loadChainStatistics(), catalogued);
        List<ChainStatistic> tracked = new ArrayList<>();
        for (ChainStatistic row : rows) {
            if (catalogued.contains(row.getChainId())) {
                tracked.add(row);
            } else {
                log.warn("Pass {}: chain statistic {} has no catalogued token, left stale",
                        NAME, CrossChainId.nameOf(row.getChainId()));
            }
        }

        List<ChainStatistic> transferRows = tracked.stream().filter(r -> r.getChainId() != relayChainId).toList();
        Map<Long, Map<Long, Long>> inDeltas = CheckpointDeltas.prefetch(
                transferRows.stream().map(ChainStatistic::getLastInCheckId).toList(), newInId,
                from -> ledgerReader.countByChain(LedgerStream.DST_TRANSFER, from, newInId));
        Map<Long, Map<Long, Long>> outDeltas = CheckpointDeltas.prefetch(
                transferRows.stream().map(ChainStatistic::getLastOutCheckId).toList(), newOutId,
                from -> ledgerReader.countByChain(LedgerStream.SRC_TRANSFER, from, newOutId));
        List<ChainStatistic> relayRows = tracked.stream().filter(r -> r.getChainId() == relayChainId).toList();
        Set<Long> relayCheckpoints = new HashSet<>();
        relayRows.forEach(r -> {
            relayCheckpoints.add(r.getLastInCheckId());
            relayCheckpoints.add(r.getLastOutCheckId());
        });
        Map<Long, Long> relayDeltas = CheckpointDeltas.prefetch(relayCheckpoints, newRelayId,
                from -> ledgerReader.countRelay(from, newRelayId));

        int saved = 0;
        int failed = 0;
        for (ChainStatistic row : tracked) {
            boolean changed = row.getId() == null;
            if (row.getChainId() == relayChainId) {
                changed |= foldRelay(row, relayDeltas, newRelayId);
            } else {
                changed |= foldTransfers(row, inDeltas, outDeltas, newInId, newOutId);
            }
            if (!changed) {
                continue;
            }
            try {
                store.save(row);
                saved++;
            } catch (DataAccessException e) {
                failed++;
                log.warn("Pass {}: failed to save chain statistic {}, retried next tick: {}",
                        NAME, CrossChainId.nameOf(row.getChainId()), e.getMessage());
            }
        }
        log.info("Pass {}: in up to {}, out up to {}, relay up to {}; saved {}, stale {}, failed {} of {} rows",
                NAME, newInId, newOutId, newRelayId, saved, rows.size() - tracked.size(), failed, rows.size());
    }

    private static boolean foldTransfers(ChainStatistic row, Map<Long, Map<Long, Long>> inDeltas,
                                         Map<Long, Map<Long, Long>> outDeltas, long newInId, long newOutId) {
        boolean changed = false;
        Map<Long, Long> in = inDeltas.get(row.getLastInCheckId());
        if (in != null) {
            row.setIn(row.getIn() + in.getOrDefault(row.getChainId(), 0L));
            row.setLastInCheckId(newInId);
            changed = true;
        }
        Map<Long, Long> out = outDeltas.get(row.getLastOutCheckId());
        if (out != null) {
            row.setOut(row.getOut() + out.getOrDefault(row.getChainId(), 0L));
            row.setLastOutCheckId(newOutId);
            changed = true;
        }
        return changed;
    }

    private static boolean foldRelay(ChainStatistic row, Map<Long, Long> relayDeltas, long newRelayId) {
        boolean changed = false;
        Long in = relayDeltas.get(row.getLastInCheckId());
        if (in != null) {
            row.setIn(row.getIn() + in);
            row.setLastInCheckId(newRelayId);
            changed = true;
        }
        Long out = relayDeltas.get(row.getLastOutCheckId());
        if (out != null) {
            row.setOut(row.getOut() + out);
            row.setLastOutCheckId(newRelayId);
            changed = true;
        }
        return changed;
    }

    private static List<ChainStatistic> withCatalogRows(List<ChainStatistic> existing, Set<Long> catalogued) {
        List<ChainStatistic> rows = new ArrayList<>(existing);
        Set<Long> known = new HashSet<>();
        existing.forEach(r -> known.add(r.getChainId()));
        for (Long chainId : catalogued) {
            if (known.add(chainId)) {
                rows.add(ChainStatistic.empty(chainId));
                log.info("Pass {}: created chain statistic row for {}", NAME, CrossChainId.nameOf(chainId));
            }
        }
        return rows;
    }
}
