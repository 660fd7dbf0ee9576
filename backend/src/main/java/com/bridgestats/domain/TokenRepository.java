package com.bridgestats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for tokens keyed by (chainId, hash).
 */
public interface TokenRepository extends MongoRepository<Token, String> {

    List<Token> findByTokenBasicName(String tokenBasicName);
}
