package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/** /earnings 응답 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwelveDataEarnings extends TwelveDataPayload {

    private List<Row> earnings;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Row {
        private String date;

        @JsonProperty("eps_actual")
        @JsonAlias("eps")
        private String epsActual;

        @JsonProperty("eps_estimate")
        private String epsEstimate;

        private String difference;

        @JsonProperty("surprise_prc")
        private String surprisePrc;
    }
}
