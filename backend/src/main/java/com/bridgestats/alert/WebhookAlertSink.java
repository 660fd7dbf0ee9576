package com.bridgestats.alert;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Posts markdown messages to a chat webhook. Delivered content keys are remembered in a Caffeine cache
 * so an unchanged alert is not re-posted on every reconciliation tick.
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private final WebClient webClient;
    private final String webhookUrl;
    private final Duration timeout;
    private final Cache<String, Boolean> delivered;

    public WebhookAlertSink(WebClient.Builder builder, String webhookUrl, Duration timeout,
                            Cache<String, Boolean> delivered) {
        this.webClient = builder.build();
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
        this.delivered = delivered;
    }

    @Override
    public boolean send(AlertMessage message) {
        String key = message.contentKey();
        if (delivered.getIfPresent(key) != null) {
            log.debug("Suppressing duplicate alert '{}'", message.title());
            return false;
        }
        Map<String, Object> payload = Map.of(
                "msgtype", "markdown",
                "markdown", Map.of(
                        "title", message.title(),
                        "text", message.title() + "\n" + message.body()));
        try {
            String response = webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            log.info("Alert '{}' delivered, webhook response: {}", message.title(), response);
        } catch (Exception e) {
            throw new AlertDeliveryException("Failed to post alert '" + message.title() + "'", e);
        }
        delivered.put(key, Boolean.TRUE);
        return true;
    }
}
