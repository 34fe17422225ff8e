package com.example.finrecon.repo;

import com.example.finrecon.model.EconomicIndicator;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface EconomicIndicatorRepository extends ReactiveCrudRepository<EconomicIndicator, String> {
    Flux<EconomicIndicator> findByIndicatorCodeAndCountryOrderByPeriodDateDesc(String indicatorCode, String country);

    Flux<EconomicIndicator> findByCountryOrderByPeriodDateDesc(String country);
}
