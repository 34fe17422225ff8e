package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** /vX/reference/financials 응답 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolygonFinancials {

    private String status;
    private List<Result> results;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        @JsonProperty("fiscal_year")
        private String fiscalYear;

        /** Q1..Q4 or FY */
        @JsonProperty("fiscal_period")
        private String fiscalPeriod;

        @JsonProperty("end_date")
        private String endDate;

        @JsonProperty("filing_date")
        private String filingDate;

        private Statements financials;

        public String incomeValue(String line) {
            if (financials == null || financials.getIncomeStatement() == null) return null;
            Line l = financials.getIncomeStatement().get(line);
            return l == null ? null : l.getValue();
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Statements {
        @JsonProperty("income_statement")
        private Map<String, Line> incomeStatement;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Line {
        private String value;
        private String unit;
    }
}
