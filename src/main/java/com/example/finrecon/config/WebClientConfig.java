package com.example.finrecon.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * 제공자별 WebClient. 각 빈은 한 제공자의 API 루트에 묶인다.
 */
@Configuration
public class WebClientConfig {

    private static WebClient mk(String baseUrl) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(Duration.ofSeconds(20))
                .httpResponseDecoder(h -> h
                        .maxHeaderSize(64 * 1024)
                        .maxInitialLineLength(8 * 1024));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(ExchangeStrategies.builder()
                        // FRED/Polygon 응답이 수 MB 까지 커질 수 있음
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .defaultHeader("User-Agent", "finrecon-java-lite/0.1")
                .build();
    }

    @Bean("fmpHttp")
    public WebClient fmpHttp(@Value("${providers.fmp.base-url:https://financialmodelingprep.com}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("alphaVantageHttp")
    public WebClient alphaVantageHttp(@Value("${providers.alpha-vantage.base-url:https://www.alphavantage.co}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("finnhubHttp")
    public WebClient finnhubHttp(@Value("${providers.finnhub.base-url:https://finnhub.io}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("fredHttp")
    public WebClient fredHttp(@Value("${providers.fred.base-url:https://api.stlouisfed.org}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("twelveDataHttp")
    public WebClient twelveDataHttp(@Value("${providers.twelve-data.base-url:https://api.twelvedata.com}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("tiingoHttp")
    public WebClient tiingoHttp(@Value("${providers.tiingo.base-url:https://api.tiingo.com}") String baseUrl) {
        return mk(baseUrl);
    }

    @Bean("polygonHttp")
    public WebClient polygonHttp(@Value("${providers.polygon.base-url:https://api.polygon.io}") String baseUrl) {
        return mk(baseUrl);
    }
}
