package com.bridgestats.reserve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;
import java.time.Duration;

/**
 * GETs a JSON body of the form {@code {"Balance": 123}} and returns the balance.
 */
public class HttpExternalBalanceClient implements ExternalBalanceClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpExternalBalanceClient(WebClient.Builder builder, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public BigInteger fetchBalance(String url) {
        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new ExternalLookupException("Balance lookup failed: " + url, e);
        }
        return parseBalance(body, url);
    }

    BigInteger parseBalance(String body, String url) {
        if (body == null || body.isBlank()) {
            throw new ExternalLookupException("Empty balance response from " + url);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ExternalLookupException("Malformed balance response from " + url, e);
        }
        JsonNode balance = root.has("Balance") ? root.get("Balance") : root.get("balance");
        if (balance == null || balance.isNull()) {
            throw new ExternalLookupException("No balance in response from " + url);
        }
        if (balance.isIntegralNumber()) {
            return balance.bigIntegerValue();
        }
        try {
            return new BigInteger(balance.asText().trim());
        } catch (NumberFormatException e) {
            throw new ExternalLookupException("Non-integer balance '" + balance.asText() + "' from " + url, e);
        }
    }
}
