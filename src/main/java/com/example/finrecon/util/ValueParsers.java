package com.example.finrecon.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 제공자 응답 값 파싱 도우미. 파싱할 수 없는 값은 예외 대신 null 을 돌려준다.
 */
public final class ValueParsers {

    private ValueParsers() {}

    /**
     * Parses a provider numeric field. FRED sends "." for a missing observation and
     * Alpha Vantage sends "None"; both map to null.
     */
    public static Double number(String raw) {
        if (raw == null) return null;
        String t = raw.trim();
        if (t.endsWith("%")) t = t.substring(0, t.length() - 1).trim();
        if (t.isEmpty() || ".".equals(t) || "None".equalsIgnoreCase(t) || "null".equalsIgnoreCase(t) || "-".equals(t)) {
            return null;
        }
        try {
            double v = Double.parseDouble(t.replace(",", ""));
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double number(Number raw) {
        if (raw == null) return null;
        double v = raw.doubleValue();
        return Double.isFinite(v) ? v : null;
    }

    /** Accepts {@code yyyy-MM-dd} with an optional time suffix ({@code 2024-01-01 00:00:00}, ISO instant). */
    public static LocalDate day(String raw) {
        if (raw == null) return null;
        String t = raw.trim();
        if (t.length() < 10) return null;
        try {
            return LocalDate.parse(t.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Calendar quarter (1-4) of the given date. */
    public static Integer quarterOf(LocalDate date) {
        if (date == null) return null;
        return (date.getMonthValue() - 1) / 3 + 1;
    }
}
