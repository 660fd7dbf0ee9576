package com.bridgestats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for token_basics keyed by name.
 */
public interface TokenBasicRepository extends MongoRepository<TokenBasic, String> {

    List<TokenBasic> findByProperty(int property);
}
