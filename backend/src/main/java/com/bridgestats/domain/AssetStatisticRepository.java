package com.bridgestats.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface AssetStatisticRepository extends MongoRepository<AssetStatistic, String> {
}
