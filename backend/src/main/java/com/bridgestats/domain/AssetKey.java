package com.bridgestats.domain;

import java.util.Locale;

/**
 * Composite key of a chain-specific asset. Hashes compare case-insensitively.
 */
public record AssetKey(long chainId, String hash) {

    public AssetKey {
        hash = hash == null ? "" : hash.toLowerCase(Locale.ROOT);
    }
}
