package com.example.finrecon.service.merge;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 파생 지표 계산. 피연산자가 없거나 분모가 0 이면 null(부재)을 돌려주며 0/NaN/Infinity 는 만들지 않는다.
 */
public final class DerivedMetrics {

    public static final String BEAT = "beat";
    public static final String MISS = "miss";
    public static final String MET = "met";

    private DerivedMetrics() {}

    /** round4(current - previous); null when previous is absent or zero. */
    public static Double change(Double current, Double previous) {
        if (current == null || isZeroOrAbsent(previous)) return null;
        return round(current - previous, 4);
    }

    /** round2(change(current, previous) / previous * 100); uses the already rounded change. */
    public static Double changePercent(Double current, Double previous) {
        Double change = change(current, previous);
        if (change == null) return null;
        return round(change / previous * 100.0, 2);
    }

    /** round4(actual - estimate); null when either side is absent. */
    public static Double surprise(Double actual, Double estimate) {
        if (actual == null || estimate == null) return null;
        return round(actual - estimate, 4);
    }

    /** round2(surprise / estimate * 100); null when the estimate is absent or zero. */
    public static Double surprisePercent(Double surprise, Double estimate) {
        if (surprise == null || isZeroOrAbsent(estimate)) return null;
        return round(surprise / estimate * 100.0, 2);
    }

    /** "beat" / "miss", and "met" for an exactly-zero surprise. */
    public static String beatMissMet(Double surprise) {
        if (surprise == null) return null;
        if (surprise > 0) return BEAT;
        if (surprise < 0) return MISS;
        return MET;
    }

    /** round4(numerator / denominator); used for margins. */
    public static Double ratio(Double numerator, Double denominator) {
        if (numerator == null || isZeroOrAbsent(denominator)) return null;
        return round(numerator / denominator, 4);
    }

    static Double round(double v, int scale) {
        if (!Double.isFinite(v)) return null;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean isZeroOrAbsent(Double v) {
        return v == null || v == 0.0;
    }
}
