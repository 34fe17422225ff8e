package com.example.finrecon.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("finrecon-java-lite API")
                        .version("0.1.0")
                        .description("FMP/Alpha Vantage/Finnhub/FRED/Twelve Data/Tiingo/Polygon 다중 제공자 경제지표·실적 수집 및 병합 API"));
    }
}
