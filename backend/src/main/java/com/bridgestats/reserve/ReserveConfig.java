package com.bridgestats.reserve;

import com.bridgestats.alert.AlertProperties;
import com.bridgestats.alert.AlertSink;
import com.bridgestats.chain.ChainDataClient;
import com.bridgestats.ledger.LedgerReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Reserve reconciler wiring. The override table is validated here, so a duplicate entry fails startup.
 */
@Configuration
@EnableConfigurationProperties(ReserveProperties.class)
@Slf4j
public class ReserveConfig {

    @Bean
    public SupplyOverrides supplyOverrides(ReserveProperties properties) {
        SupplyOverrides overrides = SupplyOverrides.from(properties.getSupplyOverrides());
        log.info("Loaded {} supply overrides, {} extra basics", overrides.size(), properties.getExtraBasics().size());
        return overrides;
    }

    @Bean
    public ExternalBalanceClient externalBalanceClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                                       ReserveProperties properties) {
        return new HttpExternalBalanceClient(webClientBuilder, objectMapper,
                Duration.ofSeconds(properties.getLookupTimeoutSeconds()));
    }

    @Bean
    public ReserveReconciler reserveReconciler(LedgerReader ledgerReader, ChainDataClient chainDataClient,
                                               ExternalBalanceClient externalBalanceClient, AlertSink alertSink,
                                               SupplyOverrides supplyOverrides, ReserveProperties properties,
                                               AlertProperties alertProperties) {
        return new ReserveReconciler(ledgerReader, chainDataClient, externalBalanceClient, alertSink,
                supplyOverrides, properties, alertProperties);
    }
}
