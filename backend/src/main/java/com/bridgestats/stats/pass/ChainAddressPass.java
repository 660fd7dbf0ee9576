package com.bridgestats.stats.pass;

import com.bridgestats.domain.ChainStatistic;
import com.bridgestats.domain.CrossChainId;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Recomputes the active-address count of every chain row from scratch. Only the address field is written,
 * so the chain statistic pass keeps sole ownership of counts and checkpoints.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChainAddressPass implements ScheduledPass {

    public static final String NAME = "chain-address";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        Map<Long, Set<String>> addresses = ledgerReader.activeAddressesByChain();
        int updated = 0;
        for (ChainStatistic row : store.loadChainStatistics()) {
            long count = addresses.getOrDefault(row.getChainId(), Set.of()).size();
            if (count == row.getAddresses()) {
                continue;
            }
            try {
                if (store.updateChainAddresses(row.getChainId(), count)) {
                    updated++;
                }
            } catch (DataAccessException e) {
                log.warn("Pass {}: failed to update addresses of chain {}: {}",
                        NAME, CrossChainId.nameOf(row.getChainId()), e.getMessage());
            }
        }
        log.info("Pass {}: updated {} chain rows", NAME, updated);
    }
}
