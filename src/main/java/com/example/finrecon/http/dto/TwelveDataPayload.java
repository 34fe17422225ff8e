package com.example.finrecon.http.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/** Twelve Data 는 오류를 {"status":"error","message":...} 본문으로 돌려준다. */
@Data
public abstract class TwelveDataPayload {

    private String status;
    private String message;

    @JsonIgnore
    public boolean isError() {
        return "error".equalsIgnoreCase(status);
    }
}
