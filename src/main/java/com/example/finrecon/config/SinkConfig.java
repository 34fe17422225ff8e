package com.example.finrecon.config;

import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.repo.EarningsReportRepository;
import com.example.finrecon.repo.EconomicIndicatorRepository;
import com.example.finrecon.service.RecordSink;
import com.example.finrecon.service.RepositoryRecordSink;
import com.example.finrecon.service.merge.EarningsSchema;
import com.example.finrecon.service.merge.IndicatorSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SinkConfig {

    @Bean
    public RecordSink<EconomicIndicator> indicatorSink(EconomicIndicatorRepository repo, IndicatorSchema schema) {
        return new RepositoryRecordSink<>(repo, schema, "economic_indicators");
    }

    @Bean
    public RecordSink<EarningsReport> earningsSink(EarningsReportRepository repo, EarningsSchema schema) {
        return new RepositoryRecordSink<>(repo, schema, "earnings_data");
    }
}
