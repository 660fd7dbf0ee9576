package com.bridgestats.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bridge-assigned chain identifiers. {@link #POLY} is the relay chain.
 */
public enum CrossChainId {
    POLY(0),
    BTC(1),
    ETHEREUM(2),
    ONT(3),
    NEO(4),
    SWITCHEO(5),
    BSC(6),
    HECO(7),
    O3(10),
    NEO3(11),
    OK(12);

    private final long id;

    CrossChainId(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    public static Optional<CrossChainId> of(long id) {
        return Arrays.stream(values()).filter(c -> c.id == id).findFirst();
    }

    /** Human-readable name for logs and alerts; falls back to the numeric id. */
    public static String nameOf(long id) {
        return of(id).map(Enum::name).orElse(String.valueOf(id));
    }
}
