package com.bridgestats.reserve;

import java.util.List;

/**
 * One reconciliation run. Unreliable details belong to basics on the extra list and never alert.
 */
public record ReserveReport(List<AssetDetail> reliable, List<AssetDetail> unreliable) {

    public ReserveReport {
        reliable = List.copyOf(reliable);
        unreliable = List.copyOf(unreliable);
    }

    public List<AssetDetail> material() {
        return reliable.stream().filter(AssetDetail::isMaterial).toList();
    }
}
