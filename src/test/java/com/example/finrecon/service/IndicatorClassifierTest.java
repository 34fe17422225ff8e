package com.example.finrecon.service;

import com.example.finrecon.model.IndicatorMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorClassifierTest {

    private final IndicatorClassifier classifier = new IndicatorClassifier();

    @Test
    @DisplayName("제공자 코드가 달라도 같은 표준 코드로 분류")
    void providerCodesMapToStandardCodes() {
        assertEquals("GDP", classifier.classify("REAL_GDP").getStandardCode());
        assertEquals("CPI", classifier.classify("CPIAUCSL").getStandardCode());
        assertEquals("UNEMPLOYMENT", classifier.classify("unemploymentRate").getStandardCode());
        assertEquals("UNEMPLOYMENT", classifier.classify("UNRATE").getStandardCode());
        assertEquals("FEDERAL_FUNDS_RATE", classifier.classify("FEDFUNDS").getStandardCode());
        assertEquals("FEDERAL_FUNDS_RATE", classifier.classify("FEDRATE").getStandardCode());
        assertEquals("INDUSTRIAL_PRODUCTION", classifier.classify("INDUSTRIAL_PRODUCTION").getStandardCode());
        assertEquals("RETAIL_SALES", classifier.classify("RETAIL_SALES").getStandardCode());
        assertEquals("HOUSING_STARTS", classifier.classify("HOUSING_STARTS").getStandardCode());
    }

    @Test
    void gdpMetadata() {
        IndicatorMetadata m = classifier.classify("GDP");
        assertEquals("Gross Domestic Product", m.getDisplayName());
        assertEquals(3, m.getImportance());
        assertEquals("high", m.getMarketImpact());
        assertEquals("B", m.getUnit());
        assertEquals("quarterly", m.getFrequency());
        assertEquals("quarterly", m.getPeriodType());
    }

    @Test
    @DisplayName("규칙 순서: 먼저 나온 규칙이 이긴다")
    void firstMatchingRuleWins() {
        // contains both CPI and SALES
        assertEquals("CPI", classifier.classify("CPI_RETAIL_SALES").getStandardCode());
    }

    @Test
    @DisplayName("미분류 코드는 대문자 코드 + 사람이 읽는 이름")
    void fallbackHumanizes() {
        IndicatorMetadata m = classifier.classify("consumer_confidence_index");
        assertEquals("CONSUMER_CONFIDENCE_INDEX", m.getStandardCode());
        assertEquals("Consumer Confidence Index", m.getDisplayName());
        assertEquals(1, m.getImportance());
        assertEquals("low", m.getMarketImpact());
        assertEquals("Index", m.getUnit());
        assertEquals("monthly", m.getFrequency());
    }

    @Test
    void deterministic() {
        assertEquals(classifier.classify("housing_index"), classifier.classify("housing_index"));
        assertEquals("HOUSING_STARTS", classifier.classify("housing_index").getStandardCode());
    }
}
