package com.bridgestats.reserve;

import com.bridgestats.alert.AlertDeliveryException;
import com.bridgestats.alert.AlertMessage;
import com.bridgestats.alert.AlertProperties;
import com.bridgestats.alert.AlertSink;
import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.chain.RpcException;
import com.bridgestats.common.RetryPolicy;
import com.bridgestats.common.Valuation;
import com.bridgestats.domain.CrossChainId;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;
import com.bridgestats.ledger.LedgerReader;
import com.bridgestats.ledger.TokenCatalog;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cross-checks live total supply against bridge custody for every reserve-tracked token basic.
 * <p>
 * Per chain: {@code flow = totalSupply - balance}. The home chain holds the canonical supply, so its
 * supply is zeroed unless the basic is on the extra list; configured overrides are applied after that and
 * always win. Flows are summed per basic (in the basic's precision) together with any external custody
 * lookups, and a positive sum above the USD threshold is reported in one batched alert.
 * <p>
 * Nothing is checkpointed: every run recomputes from live chain state.
 */
@Slf4j
public class ReserveReconciler {

    private final LedgerReader ledgerReader;
    private final ChainDataClient chainDataClient;
    private final ExternalBalanceClient externalBalanceClient;
    private final AlertSink alertSink;
    private final SupplyOverrides supplyOverrides;
    private final ReserveProperties properties;
    private final String alertTitle;
    private final Set<String> extraBasics;
    private final RetryPolicy balancePolicy;
    private final RetryPolicy supplyPolicy;

    public ReserveReconciler(LedgerReader ledgerReader, ChainDataClient chainDataClient,
                             ExternalBalanceClient externalBalanceClient, AlertSink alertSink,
                             SupplyOverrides supplyOverrides, ReserveProperties properties,
                             AlertProperties alertProperties) {
        this.ledgerReader = ledgerReader;
        this.chainDataClient = chainDataClient;
        this.externalBalanceClient = externalBalanceClient;
        this.alertSink = alertSink;
        this.supplyOverrides = supplyOverrides;
        this.properties = properties;
        this.alertTitle = alertProperties.getTitle();
        this.extraBasics = new HashSet<>(properties.getExtraBasics());
        this.balancePolicy = RetryPolicy.fixed(properties.getRetryDelayMs(), properties.getBalanceRetries());
        this.supplyPolicy = RetryPolicy.fixed(properties.getRetryDelayMs(), properties.getSupplyRetries());
    }

    /**
     * Reconciles all reserve-tracked basics and alerts on the material ones.
     */
    public ReserveReport checkAndAlert() {
        ReserveReport report = reconcile();
        List<AssetDetail> material = report.material();
        if (material.isEmpty()) {
            log.info("Reserve check: {} reliable, {} unreliable assets, nothing above {} USD",
                    report.reliable().size(), report.unreliable().size(), properties.getMaterialityThresholdUsd());
            return report;
        }
        AlertMessage message = formatAlert(material);
        try {
            if (!alertSink.send(message)) {
                log.info("Reserve alert for {} assets unchanged since last delivery", material.size());
            }
        } catch (AlertDeliveryException e) {
            log.error("Reserve alert for {} assets not delivered, retried next run: {}",
                    material.size(), e.getMessage(), e);
        }
        return report;
    }

    public ReserveReport reconcile() {
        TokenCatalog catalog = TokenCatalog.load(ledgerReader);
        List<AssetDetail> reliable = new ArrayList<>();
        List<AssetDetail> unreliable = new ArrayList<>();
        for (TokenBasic basic : catalog.basics()) {
            if (!basic.isReserveTracked()) {
                continue;
            }
            boolean extra = extraBasics.contains(basic.getName());
            AssetDetail detail = reconcile(basic, catalog, extra);
            log.info("Reserve {}: difference {}, usd {}, chains {}{}", basic.getName(), detail.difference(),
                    detail.amountUsd(), detail.chains().size(),
                    detail.failureReasons().isEmpty() ? "" : ", failures " + detail.failureReasons());
            (extra ? unreliable : reliable).add(detail);
        }
        return new ReserveReport(reliable, unreliable);
    }

    private AssetDetail reconcile(TokenBasic basic, TokenCatalog catalog, boolean extra) {
        List<ChainReserve> chains = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        BigDecimal difference = BigDecimal.ZERO;
        for (Token token : catalog.tokens()) {
            if (!basic.getName().equals(token.getTokenBasicName()) || !token.isReserveRelevant()) {
                continue;
            }
            long chainId = token.getChainId();
            String hash = token.getHash();
            BigInteger balance = fetch(balancePolicy, () -> chainDataClient.getBalance(chainId, hash),
                    "balance", basic, token, reasons);
            BigInteger supply = fetch(supplyPolicy, () -> chainDataClient.getTotalSupply(chainId, hash),
                    "total supply", basic, token, reasons);
            if (!extra && chainId == basic.getChainId()) {
                supply = BigInteger.ZERO;
            }
            supply = supplyOverrides.apply(basic.getName(), chainId, supply);
            ChainReserve reserve = ChainReserve.of(chainId, hash, supply, balance);
            chains.add(reserve);
            difference = difference.add(Valuation.rescale(reserve.flow(), token.getPrecision(), basic.getPrecision()));
        }
        if (!extra) {
            for (ReserveProperties.ExternalBalance external : properties.getExternalBalances()) {
                if (!basic.getName().equals(external.getBasic())) {
                    continue;
                }
                try {
                    BigInteger balance = externalBalanceClient.fetchBalance(external.getUrl());
                    chains.add(ChainReserve.external(external.getChainId(), balance));
                    difference = difference.add(new BigDecimal(balance));
                } catch (ExternalLookupException e) {
                    log.warn("Reserve {}: external balance on {} unavailable: {}",
                            basic.getName(), CrossChainId.nameOf(external.getChainId()), e.getMessage());
                    reasons.add("external balance on " + CrossChainId.nameOf(external.getChainId())
                            + ": " + e.getMessage());
                }
            }
        }
        BigDecimal amountUsd = BigDecimal.ZERO;
        BigDecimal materialUsd = BigDecimal.ZERO;
        if (difference.signum() > 0) {
            amountUsd = Valuation.usdValue(difference, basic.getPrecision(), basic.getPrice());
            if (!extra && amountUsd.compareTo(properties.getMaterialityThresholdUsd()) > 0) {
                materialUsd = amountUsd;
            }
        }
        return new AssetDetail(basic.getName(), basic.getPrecision(), basic.getPrice(), chains,
                difference, amountUsd, materialUsd, reasons);
    }

    private BigInteger fetch(RetryPolicy policy, Supplier<BigInteger> call, String what,
                             TokenBasic basic, Token token, List<String> reasons) {
        RpcException last = null;
        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(policy.getDelayMs());
            }
            try {
                return call.get();
            } catch (RpcException e) {
                last = e;
            }
        }
        String chain = CrossChainId.nameOf(token.getChainId());
        log.warn("Reserve {}: {} of {} on {} failed after {} attempts, using zero: {}",
                basic.getName(), what, token.getHash(), chain, policy.getMaxAttempts(),
                last == null ? "unknown" : last.getMessage());
        reasons.add(what + " on " + chain + ": " + (last == null ? "unknown" : last.getMessage()));
        return BigInteger.ZERO;
    }

    AlertMessage formatAlert(List<AssetDetail> material) {
        StringBuilder body = new StringBuilder();
        for (AssetDetail detail : material) {
            body.append("### ").append(detail.basicName()).append('\n')
                    .append("- difference: ").append(detail.difference().toPlainString()).append('\n')
                    .append("- amount usd: ")
                    .append(detail.materialAmountUsd().setScale(2, RoundingMode.DOWN).toPlainString())
                    .append('\n');
            for (ChainReserve chain : detail.chains()) {
                body.append("  - ").append(CrossChainId.nameOf(chain.chainId()))
                        .append(chain.synthetic() ? " (external)" : "")
                        .append(" supply ").append(chain.totalSupply())
                        .append(" balance ").append(chain.balance())
                        .append(" flow ").append(chain.flow())
                        .append('\n');
            }
            detail.failureReasons().forEach(r -> body.append("  - failed: ").append(r).append('\n'));
        }
        return new AlertMessage(alertTitle, body.toString());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during reserve retry", e);
        }
    }
}
