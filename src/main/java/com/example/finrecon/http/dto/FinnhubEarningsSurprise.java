package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/** /api/v1/stock/earnings 응답 원소 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubEarningsSurprise {
    private String symbol;
    private String period;
    private String actual;
    private String estimate;
    private String surprise;
    private String surprisePercent;
}
