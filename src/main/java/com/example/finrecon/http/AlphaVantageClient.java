package com.example.finrecon.http;

import com.example.finrecon.http.dto.AlphaVantageEarnings;
import com.example.finrecon.http.dto.AlphaVantageSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class AlphaVantageClient {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    private final WebClient http;
    private final String apiKey;

    public AlphaVantageClient(@Qualifier("alphaVantageHttp") WebClient http,
                              @Value("${providers.alpha-vantage.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() {
        return !this.apiKey.isBlank();
    }

    /** Economic series function (REAL_GDP, CPI, UNEMPLOYMENT, FEDERAL_FUNDS_RATE). */
    public Mono<AlphaVantageSeries> economicSeries(String function) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/query")
                        .queryParam("function", function)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(AlphaVantageSeries.class)
                .doOnError(e -> log.warn("AlphaVantage {} failed: {}", function, e.toString()));
    }

    /** EARNINGS for a single symbol */
    public Mono<AlphaVantageEarnings> earnings(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/query")
                        .queryParam("function", "EARNINGS")
                        .queryParam("symbol", symbol)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(AlphaVantageEarnings.class)
                .doOnError(e -> log.warn("AlphaVantage EARNINGS failed for {}: {}", symbol, e.toString()));
    }
}
