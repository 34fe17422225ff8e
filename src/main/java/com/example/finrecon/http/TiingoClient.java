package com.example.finrecon.http;

import com.example.finrecon.http.dto.TiingoStatement;
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
public class TiingoClient {

    private static final Logger log = LoggerFactory.getLogger(TiingoClient.class);

    private final WebClient http;
    private final String apiKey;

    public TiingoClient(@Qualifier("tiingoHttp") WebClient http,
                        @Value("${providers.tiingo.api-key:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** https://api.tiingo.com/tiingo/fundamentals/AAPL/statements?token=... */
    public Mono<List<TiingoStatement>> statements(String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(b -> b.path("/tiingo/fundamentals/{symbol}/statements")
                        .queryParam("token", apiKey)
                        .build(symbol.toLowerCase()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<TiingoStatement>>() {})
                .doOnError(e -> log.warn("Tiingo statements failed for {}: {}", symbol, e.toString()));
    }
}
