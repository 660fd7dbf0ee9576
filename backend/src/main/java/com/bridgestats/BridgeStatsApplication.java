package com.bridgestats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Background statistics engine for the cross-chain bridge. No HTTP surface; the stats engine lifecycle
 * bean starts every pass once the context is up.
 */
@SpringBootApplication
public class BridgeStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeStatsApplication.class, args);
    }
}
