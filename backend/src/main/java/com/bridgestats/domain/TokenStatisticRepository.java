package com.bridgestats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for token_statistics. Written only by the token statistic pass.
 */
public interface TokenStatisticRepository extends MongoRepository<TokenStatistic, String> {
}
