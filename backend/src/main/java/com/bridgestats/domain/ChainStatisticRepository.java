package com.bridgestats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ChainStatisticRepository extends MongoRepository<ChainStatistic, String> {
}
