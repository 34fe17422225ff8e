package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** query?function=REAL_GDP|CPI|UNEMPLOYMENT|FEDERAL_FUNDS_RATE 응답 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlphaVantageSeries extends AlphaVantagePayload {

    private String name;
    private String interval;
    private String unit;

    @JsonProperty("data")
    private List<Point> data = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        private String date;
        private String value;
    }
}
