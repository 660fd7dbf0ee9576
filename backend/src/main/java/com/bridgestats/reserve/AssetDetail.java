package com.bridgestats.reserve;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reconciliation result of one token basic.
 *
 * @param difference        sum of the chain flows, in the basic's precision
 * @param amountUsd         USD value of a positive difference, zero otherwise
 * @param materialAmountUsd {@code amountUsd} when above the threshold, zero otherwise
 * @param failureReasons    fetches that degraded to zero or lookups that were skipped
 */
public record AssetDetail(String basicName, int precision, long price, List<ChainReserve> chains,
                          BigDecimal difference, BigDecimal amountUsd, BigDecimal materialAmountUsd,
                          List<String> failureReasons) {

    public AssetDetail {
        chains = List.copyOf(chains);
        failureReasons = List.copyOf(failureReasons);
    }

    public boolean isMaterial() {
        return materialAmountUsd.signum() > 0;
    }
}
