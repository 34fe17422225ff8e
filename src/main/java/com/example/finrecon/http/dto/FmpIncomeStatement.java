package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/** GET /api/v3/income-statement/{symbol}?period=quarter 응답 원소 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpIncomeStatement {
    private String date;
    private String symbol;
    private String period;          // Q1..Q4, FY
    private String revenue;
    private String netIncome;
    private String grossProfit;
    private String operatingIncome;
    private String ebitda;
    private String eps;
}
