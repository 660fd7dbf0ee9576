package com.bridgestats.reserve;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Reserve reconciliation settings. Documented in application.yml under bridgestats.reserve.
 */
@ConfigurationProperties(prefix = "bridgestats.reserve")
@NoArgsConstructor
@Getter
@Setter
public class ReserveProperties {

    /** Positive outstanding flow above this USD value is reported. */
    private BigDecimal materialityThresholdUsd = BigDecimal.valueOf(10_000);

    /**
     * Basics whose on-chain figures are known to be unreliable: their home-chain supply is kept and
     * they are reported separately without alerting.
     */
    private List<String> extraBasics = new ArrayList<>();

    /** Corrected total supply for (basic, chain) pairs whose on-chain supply is misleading. */
    private List<SupplyOverride> supplyOverrides = new ArrayList<>();

    /** Custody held outside the tracked chains, fetched over HTTP. */
    private List<ExternalBalance> externalBalances = new ArrayList<>();

    private int balanceRetries = 4;
    private int supplyRetries = 2;
    private long retryDelayMs = 1_000;
    private int lookupTimeoutSeconds = 10;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SupplyOverride {
        private String basic;
        private long chainId;
        /** Raw amount in the token's own precision. */
        private BigInteger totalSupply;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ExternalBalance {
        private String basic;
        /** Chain id reported for the synthetic entry. */
        private long chainId;
        /** Endpoint answering {@code {"Balance": <raw amount>}}. */
        private String url;
    }
}
