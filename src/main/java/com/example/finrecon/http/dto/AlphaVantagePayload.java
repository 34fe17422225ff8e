package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Alpha Vantage 는 한도 초과/오류를 HTTP 200 본문(Note, Error Message, Information)으로 알린다.
 */
@Data
public abstract class AlphaVantagePayload {

    @JsonProperty("Note")
    private String note;

    @JsonProperty("Error Message")
    private String errorMessage;

    @JsonProperty("Information")
    private String information;

    /** Provider-reported error or rate-limit notice, or {@code null}. */
    @JsonIgnore
    public String providerError() {
        if (errorMessage != null && !errorMessage.isBlank()) return errorMessage;
        if (note != null && !note.isBlank()) return note;
        if (information != null && !information.isBlank()) return information;
        return null;
    }
}
