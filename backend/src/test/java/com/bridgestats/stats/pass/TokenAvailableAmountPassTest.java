package com.bridgestats.stats.pass;

import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.chain.RpcException;
import com.bridgestats.domain.Token;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.stats.store.StatisticStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static com.bridgestats.stats.pass.StatsFixtures.BSC;
import static com.bridgestats.stats.pass.StatsFixtures.ETHEREUM;
import static com.bridgestats.stats.pass.StatsFixtures.HECO;
import static com.bridgestats.stats.pass.StatsFixtures.token;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenAvailableAmountPassTest {

    @Mock
    private LedgerReader ledgerReader;
    @Mock
    private StatisticStore store;
    @Mock
    private ChainDataClient chainDataClient;

    @Test
    @DisplayName("refreshes changed balances and skips tokens whose read fails")
    void run_refreshesAndSkipsFailures() {
        Token eth = token(ETHEREUM, "0xeth", "USDT", 6);
        Token bsc = token(BSC, "0xbsc", "USDT", 18);
        bsc.setAvailableAmount(new BigDecimal(10));
        Token heco = token(HECO, "0xheco", "USDT", 18);
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(eth, bsc, heco));
        when(chainDataClient.getBalance(ETHEREUM, "0xeth")).thenThrow(new RpcException("unreachable"));
        when(chainDataClient.getBalance(BSC, "0xbsc")).thenReturn(BigInteger.TEN);
        when(chainDataClient.getBalance(HECO, "0xheco")).thenReturn(BigInteger.valueOf(77));

        new TokenAvailableAmountPass(ledgerReader, store, chainDataClient).run();

        verify(store).updateTokenAvailableAmount(HECO, "0xheco", new BigDecimal(77));
        verify(store, never()).updateTokenAvailableAmount(eq(BSC), any(), any());
        verify(store, never()).updateTokenAvailableAmount(eq(ETHEREUM), any(), any());
    }
}
