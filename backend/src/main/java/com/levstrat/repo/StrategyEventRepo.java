package com.levstrat.repo;

import com.levstrat.model.StrategyEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface StrategyEventRepo extends MongoRepository<StrategyEventDocument, String> {
    List<StrategyEventDocument> findTop100ByStrategyOrderByTsDesc(String strategy);

    List<StrategyEventDocument> findTop100ByStrategyAndTypeOrderByTsDesc(String strategy, String type);
}
