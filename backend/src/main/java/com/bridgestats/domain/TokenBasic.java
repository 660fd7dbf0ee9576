package com.bridgestats.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Logical asset family (e.g. WBTC) spanning chain-specific {@link Token} entries.
 * Volume totals are advanced by the token basic pass with a compare-and-set on {@code statsCheckpoint};
 * price and catalog fields are owned by other writers.
 */
@Document(collection = "token_basics")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenBasic {

    public static final int PROPERTY_RESERVE_TRACKED = 1;

    @Id
    @EqualsAndHashCode.Include
    private String name;
    /** Home chain holding the canonical supply. */
    private long chainId;
    /** Decimal digits of the canonical token. */
    private int precision;
    /** USD price scaled by 10^8. */
    private long price;
    private int property;
    private long statsCheckpoint;
    private BigDecimal totalAmount = BigDecimal.ZERO;
    private long totalCount;

    public boolean isReserveTracked() {
        return property == PROPERTY_RESERVE_TRACKED;
    }
}
