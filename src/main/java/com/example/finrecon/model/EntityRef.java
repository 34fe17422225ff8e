package com.example.finrecon.model;

import lombok.Value;

/**
 * 어댑터 호출 대상. 지표 모드는 국가 단위 지표 세트 하나, 실적 모드는 심볼 하나를 가리킨다.
 */
@Value
public class EntityRef {

    public enum Kind { INDICATOR_SET, SYMBOL }

    Kind kind;
    String value;

    public static EntityRef indicatorSet(String country) {
        return new EntityRef(Kind.INDICATOR_SET, country == null ? "US" : country.trim().toUpperCase());
    }

    public static EntityRef symbol(String symbol) {
        if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("symbol is blank");
        return new EntityRef(Kind.SYMBOL, symbol.trim().toUpperCase());
    }

    @Override
    public String toString() {
        return kind == Kind.SYMBOL ? value : "indicators:" + value;
    }
}
