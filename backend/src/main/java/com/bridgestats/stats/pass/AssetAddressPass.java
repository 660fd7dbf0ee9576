package com.bridgestats.stats.pass;

import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.AssetStatistic;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.TokenCatalog;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes the distinct sender count of every token basic across all of its chain-specific tokens.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AssetAddressPass implements ScheduledPass {

    public static final String NAME = "asset-address";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        TokenCatalog catalog = TokenCatalog.load(ledgerReader);
        Map<String, Set<String>> senders = new HashMap<>();
        for (Map.Entry<AssetKey, Set<String>> e : ledgerReader.senderAddressesByAsset().entrySet()) {
            catalog.basicOf(e.getKey()).ifPresent(basic ->
                    senders.computeIfAbsent(basic.getName(), k -> new HashSet<>()).addAll(e.getValue()));
        }
        int updated = 0;
        for (AssetStatistic row : store.loadAssetStatistics()) {
            long count = senders.getOrDefault(row.getBasicName(), Set.of()).size();
            if (count == row.getAddresses()) {
                continue;
            }
            try {
                if (store.updateAssetAddresses(row.getBasicName(), count)) {
                    updated++;
                }
            } catch (DataAccessException e) {
                log.warn("Pass {}: failed to update addresses of {}: {}", NAME, row.getBasicName(), e.getMessage());
            }
        }
        log.info("Pass {}: updated {} asset rows", NAME, updated);
    }
}
