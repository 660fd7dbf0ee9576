package com.bridgestats.ledger;

import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the ledger streams and the token catalog.
 * All ranges are open-left, closed-right: {@code (fromIdExclusive, toIdInclusive]}.
 */
public interface LedgerReader {

    /** Highest record id in the stream, or 0 when the stream is empty. */
    long highestId(LedgerStream stream);

    /** Amount and count per (chainId, asset) of a transfer stream. */
    Map<AssetKey, AmountCount> sumAndCountByAsset(LedgerStream stream, long fromIdExclusive, long toIdInclusive);

    /** Record count per chainId of a transfer stream. */
    Map<Long, Long> countByChain(LedgerStream stream, long fromIdExclusive, long toIdInclusive);

    /** Number of relay records in the range. */
    long countRelay(long fromIdExclusive, long toIdInclusive);

    /** Distinct sender addresses per chain on src_transfers merged with distinct receivers per chain on dst_transfers. */
    Map<Long, Set<String>> activeAddressesByChain();

    /** Distinct sender addresses per (chainId, asset) on src_transfers. */
    Map<AssetKey, Set<String>> senderAddressesByAsset();

    List<Token> listKnownAssets();

    List<Long> listKnownChains();

    List<TokenBasic> listKnownBasics();
}
