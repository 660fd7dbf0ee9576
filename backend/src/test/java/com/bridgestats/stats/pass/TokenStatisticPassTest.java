package com.bridgestats.stats.pass;

import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.chain.RpcException;
import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.TokenStatistic;
import com.bridgestats.ledger.AmountCount;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.LedgerStream;
import com.bridgestats.stats.engine.StatsProperties;
import com.bridgestats.stats.store.StatisticStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static com.bridgestats.stats.pass.StatsFixtures.BSC;
import static com.bridgestats.stats.pass.StatsFixtures.ETHEREUM;
import static com.bridgestats.stats.pass.StatsFixtures.USD_1;
import static com.bridgestats.stats.pass.StatsFixtures.USD_30K;
import static com.bridgestats.stats.pass.StatsFixtures.basic;
import static com.bridgestats.stats.pass.StatsFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenStatisticPassTest {

    private static final String USDT_BSC = "0xusdtbsc";
    private static final String USDC_BSC = "0xusdcbsc";
    private static final String USDT_ETH = "0xusdteth";

    @Mock
    private LedgerReader ledgerReader;
    @Mock
    private StatisticStore store;
    @Mock
    private ChainDataClient chainDataClient;

    private TokenStatisticPass pass;

    @BeforeEach
    void setUp() {
        pass = new TokenStatisticPass(ledgerReader, store, chainDataClient, new StatsProperties());
        lenient().when(ledgerReader.listKnownBasics()).thenReturn(List.of(
                basic("USDT", ETHEREUM, 6, USD_1),
                basic("USDC", ETHEREUM, 6, USD_1),
                basic("WBTC", ETHEREUM, 8, USD_30K)));
    }

    @Test
    @DisplayName("folds in/out deltas, advances both checkpoints and revalues from the cumulative amount")
    void run_foldsDeltasAndRevalues() {
        TokenStatistic row = row("r1", BSC, USDT_BSC, 10, 20);
        row.setInAmount(new BigDecimal(1_000_000));
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(BSC, USDT_BSC, "USDT", 6)));
        when(store.loadTokenStatistics()).thenReturn(List.of(row));
        highWaterMarks(15, 25);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15))
                .thenReturn(Map.of(new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(2_000_000), 2)));
        when(ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, 20, 25))
                .thenReturn(Map.of(new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(500_000), 1)));

        pass.run();

        verify(store).save(row);
        assertThat(row.getInAmount()).isEqualByComparingTo("3000000");
        assertThat(row.getInCounter()).isEqualTo(2);
        assertThat(row.getOutAmount()).isEqualByComparingTo("500000");
        assertThat(row.getOutCounter()).isEqualTo(1);
        assertThat(row.getLastInCheckId()).isEqualTo(15);
        assertThat(row.getLastOutCheckId()).isEqualTo(25);
        // $3.00 and $0.50 at storage scale 10^4
        assertThat(row.getInAmountUsd()).isEqualByComparingTo("30000");
        assertThat(row.getOutAmountUsd()).isEqualByComparingTo("5000");
        // $3.00 / $30,000 = 0.0001 BTC
        assertThat(row.getInAmountBtc()).isEqualByComparingTo("1");
        assertThat(row.getOutAmountBtc()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("second run without new ledger data queries nothing and saves nothing")
    void run_twiceWithoutNewData_isNoOp() {
        TokenStatistic row = row("r1", BSC, USDT_BSC, 10, 20);
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(BSC, USDT_BSC, "USDT", 6)));
        when(store.loadTokenStatistics()).thenReturn(List.of(row));
        highWaterMarks(15, 25);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15))
                .thenReturn(Map.of(new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(7), 1)));
        when(ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, 20, 25)).thenReturn(Map.of());

        pass.run();
        BigDecimal inAfterFirst = row.getInAmount();
        pass.run();

        verify(store, times(1)).save(any(TokenStatistic.class));
        verify(ledgerReader, times(2)).sumAndCountByAsset(any(), anyLong(), anyLong());
        assertThat(row.getInAmount()).isEqualByComparingTo(inAfterFirst);
        assertThat(row.getLastInCheckId()).isEqualTo(15);
        assertThat(row.getLastOutCheckId()).isEqualTo(25);
    }

    @Test
    @DisplayName("a failed save does not stop other rows and the row is retried from its own checkpoint")
    void run_saveFailure_otherRowsSavedAndFailedRowRetriedOnce() {
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(
                token(BSC, USDT_BSC, "USDT", 6), token(BSC, USDC_BSC, "USDC", 6)));
        TokenStatistic usdt = row("usdt", BSC, USDT_BSC, 10, 20);
        TokenStatistic usdc = row("usdc", BSC, USDC_BSC, 10, 20);
        when(store.loadTokenStatistics()).thenReturn(List.of(usdt, usdc));
        highWaterMarks(15, 20);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15)).thenReturn(Map.of(
                new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(100), 1),
                new AssetKey(BSC, USDC_BSC), new AmountCount(BigInteger.valueOf(40), 4)));
        doThrow(new OptimisticLockingFailureException("version mismatch")).when(store).save(usdt);

        pass.run();

        verify(store).save(usdc);
        assertThat(usdc.getInAmount()).isEqualByComparingTo("40");
        assertThat(usdc.getLastInCheckId()).isEqualTo(15);

        // The failed row is reloaded as it was persisted; the saved one is already at the mark.
        TokenStatistic usdtReloaded = row("usdt", BSC, USDT_BSC, 10, 20);
        when(store.loadTokenStatistics()).thenReturn(List.of(usdtReloaded, usdc));
        doReturn(usdtReloaded).when(store).save(usdtReloaded);

        pass.run();

        assertThat(usdtReloaded.getInAmount()).isEqualByComparingTo("100");
        assertThat(usdtReloaded.getInCounter()).isEqualTo(1);
        assertThat(usdtReloaded.getLastInCheckId()).isEqualTo(15);
        assertThat(usdc.getInAmount()).isEqualByComparingTo("40");
        verify(ledgerReader, times(2)).sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15);
    }

    @Test
    @DisplayName("home-chain row takes inbound amount from the live custody balance")
    void run_homeChain_usesLiveBalanceForInAmount() {
        TokenStatistic row = row("home", ETHEREUM, USDT_ETH, 10, 20);
        row.setInAmount(new BigDecimal(7));
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(ETHEREUM, USDT_ETH, "USDT", 6)));
        when(store.loadTokenStatistics()).thenReturn(List.of(row));
        highWaterMarks(15, 20);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15))
                .thenReturn(Map.of(new AssetKey(ETHEREUM, USDT_ETH), new AmountCount(BigInteger.valueOf(100), 3)));
        when(chainDataClient.getBalance(ETHEREUM, USDT_ETH)).thenReturn(BigInteger.valueOf(5_000_000));

        pass.run();

        assertThat(row.getInAmount()).isEqualByComparingTo("5000000");
        assertThat(row.getInCounter()).isEqualTo(3);
        assertThat(row.getLastInCheckId()).isEqualTo(15);
        assertThat(row.getInAmountUsd()).isEqualByComparingTo("50000");
        verify(store).save(row);
    }

    @Test
    @DisplayName("home-chain balance read failure keeps the previous inbound amount")
    void run_homeChainReadFails_keepsPreviousInAmount() {
        TokenStatistic row = row("home", ETHEREUM, USDT_ETH, 10, 20);
        row.setInAmount(new BigDecimal(7));
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(ETHEREUM, USDT_ETH, "USDT", 6)));
        when(store.loadTokenStatistics()).thenReturn(List.of(row));
        highWaterMarks(15, 20);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15))
                .thenReturn(Map.of(new AssetKey(ETHEREUM, USDT_ETH), new AmountCount(BigInteger.valueOf(100), 3)));
        when(chainDataClient.getBalance(ETHEREUM, USDT_ETH)).thenThrow(new RpcException("timeout"));

        pass.run();

        assertThat(row.getInAmount()).isEqualByComparingTo("7");
        assertThat(row.getInCounter()).isEqualTo(3);
        assertThat(row.getLastInCheckId()).isEqualTo(15);
        verify(store).save(row);
    }

    @Test
    @DisplayName("creates rows for newly catalogued tokens and leaves uncatalogued rows stale")
    void run_createsMissingRowsAndSkipsStale() {
        TokenStatistic stale = row("stale", BSC, "0xdelisted", 3, 3);
        when(store.loadTokenStatistics()).thenReturn(List.of(stale));
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(BSC, USDT_BSC, "USDT", 6)));
        highWaterMarks(5, 5);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 0, 5))
                .thenReturn(Map.of(new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(9), 1)));
        when(ledgerReader.sumAndCountByAsset(LedgerStream.SRC_TRANSFER, 0, 5)).thenReturn(Map.of());

        pass.run();

        ArgumentCaptor<TokenStatistic> saved = ArgumentCaptor.forClass(TokenStatistic.class);
        verify(store).save(saved.capture());
        assertThat(saved.getValue().key()).isEqualTo(new AssetKey(BSC, USDT_BSC));
        assertThat(saved.getValue().getInAmount()).isEqualByComparingTo("9");
        assertThat(saved.getValue().getLastInCheckId()).isEqualTo(5);
        assertThat(stale.getLastInCheckId()).isEqualTo(3);
        verify(ledgerReader, never()).sumAndCountByAsset(any(), eq(3L), anyLong());
    }

    @Test
    @DisplayName("BTC values stay unchanged when the BTC basic has no price")
    void run_withoutBtcPrice_leavesBtcUnchanged() {
        when(ledgerReader.listKnownBasics()).thenReturn(List.of(basic("USDT", ETHEREUM, 6, USD_1)));
        TokenStatistic row = row("r1", BSC, USDT_BSC, 10, 20);
        row.setInAmountBtc(new BigDecimal(42));
        when(ledgerReader.listKnownAssets()).thenReturn(List.of(token(BSC, USDT_BSC, "USDT", 6)));
        when(store.loadTokenStatistics()).thenReturn(List.of(row));
        highWaterMarks(15, 20);
        when(ledgerReader.sumAndCountByAsset(LedgerStream.DST_TRANSFER, 10, 15))
                .thenReturn(Map.of(new AssetKey(BSC, USDT_BSC), new AmountCount(BigInteger.valueOf(3_000_000), 1)));

        pass.run();

        assertThat(row.getInAmountUsd()).isEqualByComparingTo("30000");
        assertThat(row.getInAmountBtc()).isEqualByComparingTo("42");
        verify(chainDataClient, never()).getBalance(anyLong(), anyString());
    }

    private void highWaterMarks(long dst, long src) {
        when(store.highestObservedId(LedgerStream.DST_TRANSFER)).thenReturn(dst);
        when(store.highestObservedId(LedgerStream.SRC_TRANSFER)).thenReturn(src);
    }

    private static TokenStatistic row(String id, long chainId, String hash, long lastIn, long lastOut) {
        TokenStatistic s = TokenStatistic.empty(chainId, hash);
        s.setId(id);
        s.setLastInCheckId(lastIn);
        s.setLastOutCheckId(lastOut);
        return s;
    }
}
