package com.example.finrecon.http;

import com.example.finrecon.http.dto.PolygonFinancials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class PolygonClient {

    private static final Logger log = LoggerFactory.getLogger(PolygonClient.class);

    private final WebClient http;
    private final String apiKey;

    public PolygonClient(@Qualifier("polygonHttp") WebClient http,
                         @Value("${providers.polygon.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    public Mono<PolygonFinancials> quarterlyFinancials(String symbol, int limit) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/vX/reference/financials")
                        .queryParam("ticker", symbol)
                        .queryParam("timeframe", "quarterly")
                        .queryParam("limit", limit)
                        .queryParam("apiKey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(PolygonFinancials.class)
                .doOnError(e -> log.warn("Polygon financials failed for {}: {}", symbol, e.toString()));
    }
}
