package com.bridgestats.stats.pass;

import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.chain.RpcException;
import com.bridgestats.domain.CrossChainId;
import com.bridgestats.domain.Token;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.stats.engine.ScheduledPass;
import com.bridgestats.stats.store.StatisticStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Refreshes {@code availableAmount} of every catalogued token from its live custody balance.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenAvailableAmountPass implements ScheduledPass {

    public static final String NAME = "token-available";

    private final LedgerReader ledgerReader;
    private final StatisticStore store;
    private final ChainDataClient chainDataClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        List<Token> tokens = ledgerReader.listKnownAssets();
        int refreshed = 0;
        int failed = 0;
        for (Token token : tokens) {
            try {
                BigDecimal balance = new BigDecimal(chainDataClient.getBalance(token.getChainId(), token.getHash()));
                if (!CheckpointDeltas.differs(token.getAvailableAmount(), balance)) {
                    continue;
                }
                store.updateTokenAvailableAmount(token.getChainId(), token.getHash(), balance);
                refreshed++;
            } catch (RpcException | DataAccessException e) {
                failed++;
                log.warn("Pass {}: available amount of {} on {} not refreshed: {}",
                        NAME, token.getHash(), CrossChainId.nameOf(token.getChainId()), e.getMessage());
            }
        }
        log.info("Pass {}: refreshed {}, failed {} of {} tokens", NAME, refreshed, failed, tokens.size());
    }
}
