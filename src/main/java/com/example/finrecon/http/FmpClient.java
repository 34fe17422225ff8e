package com.example.finrecon.http;

import com.example.finrecon.http.dto.FmpEconomicPoint;
import com.example.finrecon.http.dto.FmpIncomeStatement;
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
public class FmpClient {

    private static final Logger log = LoggerFactory.getLogger(FmpClient.class);

    private final WebClient http;
    private final String apiKey;

    public FmpClient(@Qualifier("fmpHttp") WebClient http,
                     @Value("${providers.fmp.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** https://financialmodelingprep.com/api/v4/economic?name=GDP&apikey=... */
    public Mono<List<FmpEconomicPoint>> economic(String name) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/api/v4/economic")
                        .queryParam("name", name)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<FmpEconomicPoint>>() {})
                .doOnError(e -> log.warn("FMP economic failed for {}: {}", name, e.toString()));
    }

    /** Most recent quarterly income statements, newest first. */
    public Mono<List<FmpIncomeStatement>> quarterlyIncomeStatements(String symbol, int limit) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/api/v3/income-statement/{symbol}")
                        .queryParam("period", "quarter")
                        .queryParam("limit", limit)
                        .queryParam("apikey", apiKey)
                        .build(symbol))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<FmpIncomeStatement>>() {})
                .doOnError(e -> log.warn("FMP income-statement failed for {}: {}", symbol, e.toString()));
    }
}
