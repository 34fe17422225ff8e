package com.example.finrecon.http;

import com.example.finrecon.http.dto.FinnhubEarningsSurprise;
import com.example.finrecon.http.dto.FinnhubEconomicSeries;
import com.example.finrecon.http.dto.FinnhubFinancialsReported;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class FinnhubClient {

    private static final Logger log = LoggerFactory.getLogger(FinnhubClient.class);

    private final WebClient http;
    private final String apiKey;

    public FinnhubClient(@Qualifier("finnhubHttp") WebClient http,
                         @Value("${providers.finnhub.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** https://finnhub.io/api/v1/economic/code?code=US-CPI&token=... */
    public Mono<FinnhubEconomicSeries> economic(String code) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/economic/code")
                        .queryParam("code", code)
                        .queryParam("token", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(FinnhubEconomicSeries.class)
                .doOnError(e -> log.warn("Finnhub economic failed for {}: {}", code, e.toString()));
    }

    /** Quarterly EPS actual vs estimate, newest first. */
    public Mono<List<FinnhubEarningsSurprise>> earnings(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/stock/earnings")
                        .queryParam("symbol", symbol)
                        .queryParam("token", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<FinnhubEarningsSurprise>>() {})
                .doOnError(e -> log.warn("Finnhub earnings failed for {}: {}", symbol, e.toString()));
    }

    public Mono<FinnhubFinancialsReported> quarterlyFinancialsReported(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/stock/financials-reported")
                        .queryParam("symbol", symbol)
                        .queryParam("freq", "quarterly")
                        .queryParam("token", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(FinnhubFinancialsReported.class)
                .doOnError(e -> log.warn("Finnhub financials-reported failed for {}: {}", symbol, e.toString()));
    }
}
