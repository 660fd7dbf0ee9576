package com.bridgestats.chain;

import com.bridgestats.domain.CrossChainId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Reads custody balances and total supply over EVM JSON-RPC: {@code balanceOf(lockProxy)} and
 * {@code totalSupply()} via {@code eth_call}; native assets use {@code eth_getBalance}.
 * One attempt per call, bounded by the configured call timeout; the reserve reconciler applies its own
 * retry budget.
 */
@Slf4j
public class EvmChainDataClient implements ChainDataClient {

    static final String SELECTOR_BALANCE_OF = "0x70a08231";
    static final String SELECTOR_TOTAL_SUPPLY = "0x18160ddd";
    static final String NATIVE_ASSET = "0000000000000000000000000000000000000000";

    private final EvmRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final Duration callTimeout;
    private final Map<Long, RpcEndpointRotator> rotators = new HashMap<>();
    private final Map<Long, String> lockProxies = new HashMap<>();

    public EvmChainDataClient(EvmRpcClient rpcClient, ObjectMapper objectMapper,
                              ChainRpcProperties properties, RateLimiter rateLimiter) {
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.callTimeout = Duration.ofMillis(Math.max(1L, properties.getCallTimeoutMs()));
        properties.getNetworks().forEach((chainId, network) -> {
            if (network == null || network.getUrls() == null || network.getUrls().isEmpty()) {
                log.warn("No RPC urls configured for chain {}; chain queries will fail", CrossChainId.nameOf(chainId));
                return;
            }
            rotators.put(chainId, new RpcEndpointRotator(network.getUrls()));
            if (network.getLockProxy() != null && !network.getLockProxy().isBlank()) {
                lockProxies.put(chainId, network.getLockProxy());
            }
        });
    }

    @Override
    public BigInteger getBalance(long chainId, String assetHash) {
        String holder = lockProxy(chainId);
        String hex;
        if (isNative(assetHash)) {
            hex = call(chainId, "eth_getBalance", List.of(holder, "latest"));
        } else {
            String data = SELECTOR_BALANCE_OF + padAddress(holder);
            hex = call(chainId, "eth_call", List.of(Map.of("to", withPrefix(assetHash), "data", data), "latest"));
        }
        return hexToBigInteger(hex);
    }

    @Override
    public BigInteger getTotalSupply(long chainId, String assetHash) {
        if (isNative(assetHash)) {
            return BigInteger.ZERO;
        }
        String hex = call(chainId, "eth_call",
                List.of(Map.of("to", withPrefix(assetHash), "data", SELECTOR_TOTAL_SUPPLY), "latest"));
        return hexToBigInteger(hex);
    }

    private String call(long chainId, String method, Object params) {
        RpcEndpointRotator rotator = rotators.get(chainId);
        if (rotator == null) {
            throw new RpcException("No RPC endpoint configured for chain " + CrossChainId.nameOf(chainId));
        }
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new RpcException("RPC rate limit exceeded for chain " + CrossChainId.nameOf(chainId), e);
        }
        String endpoint = rotator.getNextEndpoint();
        String json = rpcClient.call(endpoint, method, params)
                .timeout(callTimeout)
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException("RPC call " + method + " to " + endpoint + " timed out after "
                                + callTimeout.toMillis() + " ms", e))
                .block();
        return extractResult(json);
    }

    private String lockProxy(long chainId) {
        String holder = lockProxies.get(chainId);
        if (holder == null) {
            throw new RpcException("No lock proxy configured for chain " + CrossChainId.nameOf(chainId));
        }
        return holder;
    }

    String extractResult(String json) {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException("Malformed RPC response", e);
        }
        if (root.has("error")) {
            throw new RpcException("RPC error: " + root.get("error"));
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RpcException("RPC result is null");
        }
        return result.asText();
    }

    static BigInteger hexToBigInteger(String hex) {
        if (hex == null || hex.isBlank()) {
            return BigInteger.ZERO;
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.isBlank()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(normalized, 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Malformed hex quantity in RPC result: " + hex, e);
        }
    }

    private static boolean isNative(String assetHash) {
        String stripped = stripPrefix(assetHash).toLowerCase(Locale.ROOT);
        return stripped.isEmpty() || NATIVE_ASSET.equals(stripped);
    }

    private static String padAddress(String address) {
        return String.format("%64s", stripPrefix(address)).replace(' ', '0');
    }

    private static String withPrefix(String hash) {
        return "0x" + stripPrefix(hash);
    }

    private static String stripPrefix(String hash) {
        if (hash == null) {
            return "";
        }
        return hash.startsWith("0x") || hash.startsWith("0X") ? hash.substring(2) : hash;
    }
}
