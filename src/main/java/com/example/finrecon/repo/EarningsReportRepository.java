package com.example.finrecon.repo;

import com.example.finrecon.model.EarningsReport;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface EarningsReportRepository extends ReactiveCrudRepository<EarningsReport, String> {
    Flux<EarningsReport> findBySymbolOrderByReportedDateDesc(String symbol);
}
