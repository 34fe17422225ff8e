package com.example.finrecon.service.merge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DerivedMetricsTest {

    @Test
    void changeAndPercent() {
        assertEquals(20.0, DerivedMetrics.change(100.0, 80.0));
        assertEquals(25.0, DerivedMetrics.changePercent(100.0, 80.0));
        assertEquals(5.0, DerivedMetrics.change(100.0, 95.0));
        assertEquals(5.26, DerivedMetrics.changePercent(100.0, 95.0));
    }

    @Test
    void changePercentIsDerivedFromRoundedChange() {
        // 0.00016 rounds to 0.0002, so the percent follows 0.0002 rather than the raw difference
        assertEquals(2.0E-4, DerivedMetrics.change(0.01016, 0.01));
        assertEquals(2.0, DerivedMetrics.changePercent(0.01016, 0.01));
        assertEquals(0.0, DerivedMetrics.change(0.00013, 0.0001));
        assertEquals(0.0, DerivedMetrics.changePercent(0.00013, 0.0001));
    }

    @Test
    void zeroOrMissingBaselineYieldsNull() {
        assertNull(DerivedMetrics.change(100.0, 0.0));
        assertNull(DerivedMetrics.changePercent(100.0, 0.0));
        assertNull(DerivedMetrics.change(100.0, null));
        assertNull(DerivedMetrics.change(null, 5.0));
    }

    @Test
    void surpriseAndBeatMissMet() {
        Double s = DerivedMetrics.surprise(1.10, 1.00);
        assertEquals(0.1, s);
        assertEquals(10.0, DerivedMetrics.surprisePercent(s, 1.00));
        assertEquals(DerivedMetrics.BEAT, DerivedMetrics.beatMissMet(s));
        assertEquals(DerivedMetrics.MISS, DerivedMetrics.beatMissMet(-0.02));
        assertEquals(DerivedMetrics.MET, DerivedMetrics.beatMissMet(0.0));
        assertNull(DerivedMetrics.beatMissMet(null));
        assertNull(DerivedMetrics.surprisePercent(0.5, 0.0));
    }

    @Test
    void ratioRoundsToFourDecimals() {
        assertEquals(0.3333, DerivedMetrics.ratio(1.0, 3.0));
        assertNull(DerivedMetrics.ratio(1.0, 0.0));
        assertNull(DerivedMetrics.ratio(null, 3.0));
    }

    @Test
    void roundingIsHalfUp() {
        assertEquals(0.13, DerivedMetrics.round(0.125, 2));
        assertNull(DerivedMetrics.round(Double.NaN, 2));
    }
}
