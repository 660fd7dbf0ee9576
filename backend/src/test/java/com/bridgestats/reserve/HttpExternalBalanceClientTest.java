package com.bridgestats.reserve;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpExternalBalanceClientTest {

    private static final String URL = "http://o3.example/balance";

    @Test
    void fetchBalance_parsesCapitalizedField() {
        HttpExternalBalanceClient client = client(HttpStatus.OK, "{\"Balance\": 123456789012345678901234}");

        assertThat(client.fetchBalance(URL)).isEqualTo(new BigInteger("123456789012345678901234"));
    }

    @Test
    void fetchBalance_acceptsLowercaseAndStringValues() {
        assertThat(client(HttpStatus.OK, "{\"balance\": \"42\"}").fetchBalance(URL)).isEqualTo(BigInteger.valueOf(42));
    }

    @Test
    void fetchBalance_serverError_throwsLookupException() {
        HttpExternalBalanceClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "busy");

        assertThatThrownBy(() -> client.fetchBalance(URL))
                .isInstanceOf(ExternalLookupException.class)
                .hasMessageContaining(URL);
    }

    @Test
    void fetchBalance_missingOrMalformedBalance_throwsLookupException() {
        assertThatThrownBy(() -> client(HttpStatus.OK, "{\"other\": 1}").fetchBalance(URL))
                .isInstanceOf(ExternalLookupException.class);
        assertThatThrownBy(() -> client(HttpStatus.OK, "{\"Balance\": 1.5}").fetchBalance(URL))
                .isInstanceOf(ExternalLookupException.class);
        assertThatThrownBy(() -> client(HttpStatus.OK, "not json").fetchBalance(URL))
                .isInstanceOf(ExternalLookupException.class);
    }

    private static HttpExternalBalanceClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
                ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()));
        return new HttpExternalBalanceClient(builder, new ObjectMapper(), Duration.ofSeconds(5));
    }
}
