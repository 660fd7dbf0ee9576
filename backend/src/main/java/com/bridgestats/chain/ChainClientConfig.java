package com.bridgestats.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the EVM chain data client from per-chain config.
 */
@Configuration
@EnableConfigurationProperties(ChainRpcProperties.class)
public class ChainClientConfig {

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    @Bean
    public ChainDataClient chainDataClient(EvmRpcClient evmRpcClient, ObjectMapper objectMapper,
                                           ChainRpcProperties properties, RateLimiter chainRpcRateLimiter) {
        return new EvmChainDataClient(evmRpcClient, objectMapper, properties, chainRpcRateLimiter);
    }
}
