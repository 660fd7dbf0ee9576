package com.bridgestats.ledger;

import com.bridgestats.domain.AssetKey;
import com.bridgestats.domain.Token;
import com.bridgestats.domain.TokenBasic;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Snapshot of the token catalog taken at the start of a pass: chain-specific tokens by key and
 * token basics by name.
 */
public final class TokenCatalog {

    private final Map<AssetKey, Token> tokens;
    private final Map<String, TokenBasic> basics;

    private TokenCatalog(Map<AssetKey, Token> tokens, Map<String, TokenBasic> basics) {
        this.tokens = tokens;
        this.basics = basics;
    }

    public static TokenCatalog load(LedgerReader reader) {
        return of(reader.listKnownAssets(), reader.listKnownBasics());
    }

    public static TokenCatalog of(List<Token> tokens, List<TokenBasic> basics) {
        Map<AssetKey, Token> byKey = new LinkedHashMap<>();
        for (Token token : tokens) {
            byKey.putIfAbsent(token.key(), token);
        }
        Map<String, TokenBasic> byName = new LinkedHashMap<>();
        for (TokenBasic basic : basics) {
            byName.putIfAbsent(basic.getName(), basic);
        }
        return new TokenCatalog(byKey, byName);
    }

    public Collection<Token> tokens() {
        return tokens.values();
    }

    public Collection<TokenBasic> basics() {
        return basics.values();
    }

    public Optional<Token> token(AssetKey key) {
        return Optional.ofNullable(tokens.get(key));
    }

    public Optional<TokenBasic> basic(String name) {
        return Optional.ofNullable(name == null ? null : basics.get(name));
    }

    /** The basic a chain-specific asset belongs to, if both are catalogued. */
    public Optional<TokenBasic> basicOf(AssetKey key) {
        return token(key).flatMap(t -> basic(t.getTokenBasicName()));
    }

    /** Positive price of the named basic, empty when unknown or unpriced. */
    public OptionalLong priceOf(String basicName) {
        return basic(basicName)
                .filter(b -> b.getPrice() > 0)
                .map(b -> OptionalLong.of(b.getPrice()))
                .orElseGet(OptionalLong::empty);
    }
}
