package com.bridgestats.stats.pass;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.LongFunction;

/**
 * Delta queries shared by rows sitting at the same checkpoint. Rows normally share one checkpoint;
 * after a partial save failure some lag behind and get their own range.
 */
final class CheckpointDeltas {

    private CheckpointDeltas() {
    }

    /**
     * Runs {@code query} once per distinct checkpoint below {@code highWaterMark}, i.e. once per
     * non-empty range {@code (checkpoint, highWaterMark]}. Checkpoints at or above the mark are absent
     * from the result.
     */
    static <V> Map<Long, V> prefetch(Collection<Long> checkpoints, long highWaterMark, LongFunction<V> query) {
        Map<Long, V> deltas = new HashMap<>();
        for (Long checkpoint : new TreeSet<>(checkpoints)) {
            if (checkpoint < highWaterMark) {
                deltas.put(checkpoint, query.apply(checkpoint));
            }
        }
        return deltas;
    }

    static boolean differs(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a != b;
        }
        return a.compareTo(b) != 0;
    }
}
