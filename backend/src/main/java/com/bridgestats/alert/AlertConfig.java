package com.bridgestats.alert;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Alert sink wiring: webhook client plus the dedup cache.
 */
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertConfig {

    @Bean
    public AlertSink alertSink(WebClient.Builder webClientBuilder, AlertProperties properties) {
        return new WebhookAlertSink(
                webClientBuilder,
                properties.getWebhookUrl(),
                Duration.ofSeconds(properties.getTimeoutSeconds()),
                Caffeine.newBuilder()
                        .expireAfterWrite(properties.getDedupTtlMinutes(), TimeUnit.MINUTES)
                        .maximumSize(properties.getDedupMaxEntries())
                        .build());
    }
}
