package com.example.finrecon.service.merge;

import com.example.finrecon.model.EarningsReport;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EarningsSchemaTest {

    private final RecordMerger merger = new RecordMerger();
    private final EarningsSchema schema = new EarningsSchema();

    private static EarningsReport report(String provider, int year, Integer quarter, String reported) {
        EarningsReport r = new EarningsReport();
        r.setSymbol("AAPL");
        r.setFiscalYear(year);
        r.setFiscalQuarter(quarter);
        r.setReportedDate(LocalDate.parse(reported));
        r.addProvider(provider);
        return r;
    }

    @Test
    void epsSurpriseAndBeat() {
        EarningsReport r = report("alpha_vantage", 2024, 2, "2024-08-01");
        r.setEps(1.10);
        r.setEpsEstimated(1.00);

        EarningsReport out = merger.merge(schema, List.of(r)).get(0);

        assertEquals(0.1, out.getEpsSurprise());
        assertEquals(10.0, out.getEpsSurprisePercent());
        assertEquals(DerivedMetrics.BEAT, out.getEpsBeatMissMet());
        assertNull(out.getRevenueBeatMissMet());
    }

    @Test
    void providerSurpriseIsKept() {
        EarningsReport r = report("alpha_vantage", 2024, 2, "2024-08-01");
        r.setEps(1.10);
        r.setEpsEstimated(1.00);
        r.setEpsSurprise(0.0);

        EarningsReport out = merger.merge(schema, List.of(r)).get(0);

        assertEquals(0.0, out.getEpsSurprise());
        assertEquals(DerivedMetrics.MET, out.getEpsBeatMissMet());
    }

    @Test
    void marginsFromIncomeStatement() {
        EarningsReport eps = report("finnhub", 2024, 2, "2024-06-30");
        eps.setEps(1.40);
        EarningsReport income = report("fmp", 2024, 2, "2024-06-30");
        income.setRevenue(85777.0);
        income.setOperatingIncome(25352.0);
        income.setNetIncome(21448.0);

        EarningsReport out = merger.merge(schema, List.of(eps, income)).get(0);

        assertEquals(1.40, out.getEps());
        assertEquals(0.2956, out.getOperatingMargin());
        assertEquals(0.25, out.getNetMargin());
        assertEquals("finnhub, fmp", out.getDataProvider());
        assertEquals("quarterly", out.getReportType());
    }

    @Test
    void yearOverYearGrowthMatchesSameQuarter() {
        EarningsReport now = report("fmp", 2024, 2, "2024-06-30");
        now.setEps(1.20);
        now.setRevenue(110.0);
        EarningsReport prevQuarter = report("fmp", 2024, 1, "2024-03-31");
        prevQuarter.setEps(2.00);
        EarningsReport yearAgo = report("fmp", 2023, 2, "2023-06-30");
        yearAgo.setEps(1.00);
        yearAgo.setRevenue(100.0);

        List<EarningsReport> out = merger.merge(schema, List.of(yearAgo, prevQuarter, now));

        assertEquals(2, out.get(0).getFiscalQuarter());
        assertEquals(20.0, out.get(0).getYearOverYearEpsGrowth());
        assertEquals(10.0, out.get(0).getYearOverYearRevenueGrowth());
        assertNull(out.get(1).getYearOverYearEpsGrowth());
    }

    @Test
    void annualReportsKeyedSeparately() {
        EarningsReport annual = report("polygon", 2023, null, "2023-09-30");
        EarningsReport q4 = report("polygon", 2023, 4, "2023-09-30");

        List<EarningsReport> out = merger.merge(schema, List.of(annual, q4));

        assertEquals(2, out.size());
        EarningsReport a = out.stream().filter(r -> r.getFiscalQuarter() == null).findFirst().orElseThrow();
        assertEquals(EarningsReport.ANNUAL, a.getReportType());
        assertEquals("AAPL-2023-annual", a.naturalKey());
        assertEquals("AAPL|2023|annual|polygon", schema.conflictId(a));
    }

    @Test
    void missingReportedDateDropsRecord() {
        EarningsReport r = report("fmp", 2024, 1, "2024-03-31");
        r.setReportedDate(null);

        assertTrue(merger.merge(schema, List.of(r)).isEmpty());
    }
}
