package com.accessibility.checker.repository;

import com.accessibility.checker.model.CachedAnalysis;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface CachedAnalysisRepository extends MongoRepository<CachedAnalysis, String> {

    long deleteByExpiresAtLessThanEqual(Instant instant);
}
