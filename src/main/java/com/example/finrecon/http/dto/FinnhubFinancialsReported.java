package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** /api/v1/stock/financials-reported?freq=quarterly 응답 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubFinancialsReported {

    private String symbol;
    private List<Filing> data;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Filing {
        private Integer year;
        private Integer quarter;
        private String endDate;
        private Report report;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Report {
        /** income statement line items */
        private List<LineItem> ic;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LineItem {
        private String concept;
        private String value;
    }
}
