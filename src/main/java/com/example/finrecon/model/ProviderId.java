package com.example.finrecon.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 외부 데이터 제공자 식별자. 레코드 출처(provenance)에 저장되는 코드는 {@link #code()} 값이다.
 */
public enum ProviderId {
    FMP("fmp", "Financial Modeling Prep"),
    ALPHA_VANTAGE("alpha_vantage", "Alpha Vantage"),
    FINNHUB("finnhub", "Finnhub"),
    FRED("fred", "Federal Reserve Economic Data"),
    TWELVE_DATA("twelve_data", "Twelve Data"),
    TIINGO("tiingo", "Tiingo"),
    POLYGON("polygon", "Polygon");

    private final String code;
    private final String displayName;

    ProviderId(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code() { return code; }

    public String displayName() { return displayName; }

    public static ProviderId fromCode(String code) {
        if (code == null) return null;
        for (ProviderId p : values()) {
            if (p.code.equalsIgnoreCase(code.trim())) return p;
        }
        return null;
    }
}
