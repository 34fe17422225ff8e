package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * /tiingo/fundamentals/{ticker}/statements 응답 원소.
 * quarter 0 은 연간 보고서.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TiingoStatement {

    private String date;
    private Integer year;
    private Integer quarter;
    private StatementData statementData;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatementData {
        private List<DataPoint> incomeStatement;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DataPoint {
        private String dataCode;
        private String value;
    }

    /** Value of the income statement line with the given data code, or null. */
    public String incomeValue(String dataCode) {
        if (statementData == null || statementData.getIncomeStatement() == null) return null;
        for (DataPoint p : statementData.getIncomeStatement()) {
            if (dataCode.equalsIgnoreCase(p.getDataCode())) return p.getValue();
        }
        return null;
    }
}
