package com.bridgestats.chain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain RPC endpoints and the bridge custody (lock proxy) address whose balances are read.
 * Keyed by bridge chain id, e.g. {@code bridgestats.chain.networks.2.urls[0]=https://...}.
 */
@ConfigurationProperties(prefix = "bridgestats.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    private Map<Long, Network> networks = new HashMap<>();

    /** Global RPC budget (requests per second) across all chains. */
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a rate-limit permit before failing. */
    private long limiterTimeoutMs = 5_000;

    /** Upper bound on a single JSON-RPC round trip; a slower call fails with {@link RpcException}. */
    private long callTimeoutMs = 10_000;

    @Getter
    @Setter
    public static class Network {
        private List<String> urls = new ArrayList<>();
        /** Lock proxy contract holding bridged liquidity on this chain. */
        private String lockProxy;
    }
}
