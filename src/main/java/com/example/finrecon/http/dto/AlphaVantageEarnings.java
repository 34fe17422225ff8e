package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** query?function=EARNINGS 응답 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlphaVantageEarnings extends AlphaVantagePayload {

    private String symbol;
    private List<Quarter> quarterlyEarnings = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Quarter {
        private String fiscalDateEnding;
        private String reportedDate;
        private String reportedEPS;
        private String estimatedEPS;
        private String surprise;
        private String surprisePercentage;
    }
}
