package com.bridgestats.reserve;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable (basic, chain) to total supply table. Lookups are pure; pairs not in the table keep the
 * fetched supply.
 */
public final class SupplyOverrides {

    private final Map<Key, BigInteger> overrides;

    private SupplyOverrides(Map<Key, BigInteger> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    public static SupplyOverrides from(List<ReserveProperties.SupplyOverride> entries) {
        Map<Key, BigInteger> map = new HashMap<>();
        for (ReserveProperties.SupplyOverride entry : entries) {
            if (entry.getBasic() == null || entry.getBasic().isBlank() || entry.getTotalSupply() == null) {
                throw new IllegalArgumentException("Supply override needs basic and total-supply: chain "
                        + entry.getChainId());
            }
            if (entry.getTotalSupply().signum() < 0) {
                throw new IllegalArgumentException("Negative supply override for " + entry.getBasic()
                        + " on chain " + entry.getChainId());
            }
            Key key = new Key(entry.getBasic(), entry.getChainId());
            if (map.putIfAbsent(key, entry.getTotalSupply()) != null) {
                throw new IllegalArgumentException("Duplicate supply override for " + entry.getBasic()
                        + " on chain " + entry.getChainId());
            }
        }
        return new SupplyOverrides(map);
    }

    public static SupplyOverrides empty() {
        return new SupplyOverrides(Map.of());
    }

    public Optional<BigInteger> find(String basicName, long chainId) {
        return Optional.ofNullable(overrides.get(new Key(basicName, chainId)));
    }

    public BigInteger apply(String basicName, long chainId, BigInteger fetched) {
        return find(basicName, chainId).orElse(fetched);
    }

    public int size() {
        return overrides.size();
    }

    private record Key(String basicName, long chainId) {
    }
}
