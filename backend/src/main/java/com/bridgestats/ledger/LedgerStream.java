package com.bridgestats.ledger;

/**
 * The three append-only record streams. Each is ordered by a monotonically increasing {@code _id}.
 */
public enum LedgerStream {
    SRC_TRANSFER("src_transfers"),
    DST_TRANSFER("dst_transfers"),
    RELAY("poly_transactions");

    private final String collection;

    LedgerStream(String collection) {
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }

    public boolean isTransferStream() {
        return this != RELAY;
    }
}
