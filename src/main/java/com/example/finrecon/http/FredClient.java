package com.example.finrecon.http;

import com.example.finrecon.http.dto.FredObservations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Component
public class FredClient {

    private static final Logger log = LoggerFactory.getLogger(FredClient.class);

    private final WebClient http;
    private final String apiKey;

    public FredClient(@Qualifier("fredHttp") WebClient http,
                      @Value("${providers.fred.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** Observations of one series between {@code start} and {@code end}, newest first. */
    public Mono<FredObservations> observations(String seriesId, LocalDate start, LocalDate end, int limit) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/fred/series/observations")
                        .queryParam("series_id", seriesId)
                        .queryParam("api_key", apiKey)
                        .queryParam("file_type", "json")
                        .queryParam("observation_start", start.toString())
                        .queryParam("observation_end", end.toString())
                        .queryParam("sort_order", "desc")
                        .queryParam("limit", limit)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(FredObservations.class)
                .doOnError(e -> log.warn("FRED observations failed for {}: {}", seriesId, e.toString()));
    }
}
