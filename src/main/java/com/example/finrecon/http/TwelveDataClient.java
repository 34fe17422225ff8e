package com.example.finrecon.http;

import com.example.finrecon.http.dto.TwelveDataEarnings;
import com.example.finrecon.http.dto.TwelveDataEconomicSeries;
import com.example.finrecon.http.dto.TwelveDataIncomeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class TwelveDataClient {

    private static final Logger log = LoggerFactory.getLogger(TwelveDataClient.class);

    private final WebClient http;
    private final String apiKey;

    public TwelveDataClient(@Qualifier("twelveDataHttp") WebClient http,
                            @Value("${providers.twelve-data.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    public Mono<TwelveDataEconomicSeries> economicIndicator(String indicator, String country) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/economic_indicators")
                        .queryParam("indicator", indicator)
                        .queryParam("country", country)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(TwelveDataEconomicSeries.class)
                .doOnError(e -> log.warn("TwelveData economic_indicators failed for {}: {}", indicator, e.toString()));
    }

    public Mono<TwelveDataEarnings> earnings(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/earnings")
                        .queryParam("symbol", symbol)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(TwelveDataEarnings.class)
                .doOnError(e -> log.warn("TwelveData earnings failed for {}: {}", symbol, e.toString()));
    }

    public Mono<TwelveDataIncomeStatement> quarterlyIncomeStatement(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/income_statement")
                        .queryParam("symbol", symbol)
                        .queryParam("period", "quarterly")
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(TwelveDataIncomeStatement.class)
                .doOnError(e -> log.warn("TwelveData income_statement failed for {}: {}", symbol, e.toString()));
    }
}
