package com.example.finrecon.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** ingest.schedule.*-cron 이 "-" 이면 해당 작업은 등록되지 않는다. */
@EnableScheduling
@Configuration
public class SchedulingConfig {
}
