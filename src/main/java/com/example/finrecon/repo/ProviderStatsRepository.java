package com.example.finrecon.repo;

import com.example.finrecon.model.doc.ProviderStats;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

public interface ProviderStatsRepository extends ReactiveCrudRepository<ProviderStats, String> {
}
