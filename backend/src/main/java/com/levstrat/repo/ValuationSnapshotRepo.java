package com.levstrat.repo;

import com.levstrat.model.ValuationSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ValuationSnapshotRepo extends MongoRepository<ValuationSnapshot, String> {
    List<ValuationSnapshot> findByStrategyAndTsBetweenOrderByTsAsc(String strategy, Instant from, Instant to);

    ValuationSnapshot findTopByStrategyOrderByTsDesc(String strategy);
}
