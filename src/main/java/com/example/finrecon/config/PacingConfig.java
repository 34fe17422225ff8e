package com.example.finrecon.config;

import com.example.finrecon.provider.RequestPacer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 제공자별 순차 호출 간격과 실행 기준 시계.
 */
@Configuration
public class PacingConfig {

    @Bean("fmpPacer")
    public RequestPacer fmpPacer(@Value("${providers.fmp.delay-ms:200}") long delayMs) {
        return RequestPacer.fixed(Duration.ofMillis(delayMs));
    }

    @Bean("alphaVantagePacer")
    public RequestPacer alphaVantagePacer(@Value("${providers.alpha-vantage.delay-ms:500}") long delayMs) {
        return RequestPacer.fixed(Duration.ofMillis(delayMs));
    }

    @Bean("finnhubPacer")
    public RequestPacer finnhubPacer(@Value("${providers.finnhub.delay-ms:300}") long delayMs) {
        return RequestPacer.fixed(Duration.ofMillis(delayMs));
    }

    @Bean("fredPacer")
    public RequestPacer fredPacer(@Value("${providers.fred.delay-ms:200}") long delayMs) {
        return RequestPacer.fixed(Duration.ofMillis(delayMs));
    }

    @Bean("twelveDataPacer")
    public RequestPacer twelveDataPacer(@Value("${providers.twelve-data.delay-ms:400}") long delayMs) {
        return RequestPacer.fixed(Duration.ofMillis(delayMs));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
