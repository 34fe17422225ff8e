package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/** /income_statement?period=quarterly 응답 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwelveDataIncomeStatement extends TwelveDataPayload {

    @JsonProperty("income_statement")
    private List<Row> incomeStatement;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Row {
        @JsonProperty("fiscal_date")
        private String fiscalDate;

        @JsonAlias("revenues")
        private String sales;

        @JsonProperty("gross_profit")
        private String grossProfit;

        @JsonProperty("operating_income")
        private String operatingIncome;

        @JsonProperty("net_income")
        private String netIncome;

        private String ebitda;
    }
}
