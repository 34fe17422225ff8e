package com.example.finrecon.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class IngestScheduler {

    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    private final IndicatorIngestService indicatorIngest;
    private final EarningsIngestService earningsIngest;

    @Scheduled(cron = "${ingest.schedule.indicators-cron:-}")
    public void indicators() {
        indicatorIngest.run().subscribe(
                s -> log.info("Scheduled indicator run: success={}, records={}", s.isSuccess(), s.getSummary().getTotalRecords()),
                e -> log.error("Scheduled indicator run failed: {}", e.toString()));
    }

    @Scheduled(cron = "${ingest.schedule.earnings-cron:-}")
    public void earnings() {
        earningsIngest.run(List.of()).subscribe(
                s -> log.info("Scheduled earnings run: processed={}, successful={}", s.getSummary().getProcessed(), s.getSummary().getSuccessful()),
                e -> log.error("Scheduled earnings run failed: {}", e.toString()));
    }
}
