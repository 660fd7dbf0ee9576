package com.bridgestats.stats.engine;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scheduling and aggregation settings. Documented in application.yml under bridgestats.stats.
 */
@ConfigurationProperties(prefix = "bridgestats.stats")
@NoArgsConstructor
@Getter
@Setter
public class StatsProperties {

    /** Interval in seconds per pass name, e.g. {@code token-statistic: 60}. Required for every enabled pass. */
    private Map<String, Long> intervals = new HashMap<>();

    /** Pass names that are registered but not scheduled. */
    private Set<String> disabledPasses = new HashSet<>();

    /** How long shutdown waits for in-flight passes. */
    private long shutdownAwaitSeconds = 60;

    /** Token basic whose price denominates BTC valuations. */
    private String btcBasicName = "WBTC";

    /** Bridge chain id of the relay chain. */
    private long relayChainId = 0;

    public boolean isEnabled(String passName) {
        return !disabledPasses.contains(passName);
    }

    /**
     * Configuration problems for the given registered passes; empty when the engine may start.
     */
    public List<String> validate(Collection<String> passNames) {
        List<String> problems = new ArrayList<>();
        for (String name : passNames) {
            if (!isEnabled(name)) {
                continue;
            }
            Long seconds = intervals.get(name);
            if (seconds == null) {
                problems.add("Missing interval for pass '" + name + "' (bridgestats.stats.intervals." + name + ")");
            } else if (seconds <= 0) {
                problems.add("Interval for pass '" + name + "' must be positive, got " + seconds);
            }
        }
        for (String name : disabledPasses) {
            if (!passNames.contains(name)) {
                problems.add("Unknown pass in disabled-passes: '" + name + "'");
            }
        }
        if (shutdownAwaitSeconds < 0) {
            problems.add("shutdown-await-seconds must not be negative");
        }
        if (btcBasicName == null || btcBasicName.isBlank()) {
            problems.add("btc-basic-name must be set");
        }
        return problems;
    }
}
