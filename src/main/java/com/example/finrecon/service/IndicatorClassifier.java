package com.example.finrecon.service;

import com.example.finrecon.model.IndicatorMetadata;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 제공자별 지표 코드/라벨을 표준 분류(코드, 이름, 중요도, 단위, 주기)로 매핑한다.
 * 규칙은 순서대로 검사하며 처음 일치한 규칙이 이긴다.
 */
@Component
public class IndicatorClassifier {

    private static final Pattern WORD_START = Pattern.compile("\\b\\w");

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("GDP", "GROSS_DOMESTIC"),
                    new IndicatorMetadata("GDP", "Gross Domestic Product", 3, "high", "B", "quarterly", "quarterly")),
            new Rule(List.of("CPI", "CONSUMER_PRICE", "INFLATION"),
                    new IndicatorMetadata("CPI", "Consumer Price Index", 3, "high", "Index", "monthly", "monthly")),
            new Rule(List.of("UNEMPLOYMENT", "UNRATE", "JOBLESS"),
                    new IndicatorMetadata("UNEMPLOYMENT", "Unemployment Rate", 3, "high", "%", "monthly", "monthly")),
            new Rule(List.of("FEDERAL_FUNDS", "FEDFUNDS", "FEDRATE", "INTEREST_RATE"),
                    new IndicatorMetadata("FEDERAL_FUNDS_RATE", "Federal Funds Rate", 3, "high", "%", "monthly", "monthly")),
            new Rule(List.of("INDUSTRIAL", "PRODUCTION"),
                    new IndicatorMetadata("INDUSTRIAL_PRODUCTION", "Industrial Production Index", 2, "medium", "Index", "monthly", "monthly")),
            new Rule(List.of("RETAIL", "SALES"),
                    new IndicatorMetadata("RETAIL_SALES", "Retail Sales", 2, "medium", "%", "monthly", "monthly")),
            new Rule(List.of("HOUSING", "STARTS"),
                    new IndicatorMetadata("HOUSING_STARTS", "Housing Starts", 2, "medium", "K", "monthly", "monthly"))
    );

    public IndicatorMetadata classify(String rawCodeOrLabel) {
        String raw = rawCodeOrLabel == null ? "" : rawCodeOrLabel.trim();
        String upper = raw.toUpperCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(upper)) return rule.metadata;
        }
        return new IndicatorMetadata(upper, humanize(raw), 1, "low", "Index", "monthly", "monthly");
    }

    /** "housing_index" → "Housing Index" */
    static String humanize(String raw) {
        String spaced = raw.replace('_', ' ');
        Matcher m = WORD_START.matcher(spaced);
        StringBuilder sb = new StringBuilder(spaced.length());
        while (m.find()) {
            m.appendReplacement(sb, m.group().toUpperCase(Locale.ROOT));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static final class Rule {
        private final List<String> needles;
        private final IndicatorMetadata metadata;

        private Rule(List<String> needles, IndicatorMetadata metadata) {
            this.needles = needles;
            this.metadata = metadata;
        }

        private boolean matches(String upper) {
            for (String n : needles) {
                if (upper.contains(n)) return true;
            }
            return false;
        }
    }
}
