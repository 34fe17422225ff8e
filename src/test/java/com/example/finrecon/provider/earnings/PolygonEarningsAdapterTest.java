package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FmpClient;
import com.example.finrecon.http.PolygonClient;
import com.example.finrecon.http.StubHttp;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.service.merge.EarningsSchema;
import com.example.finrecon.service.merge.RecordMerger;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolygonEarningsAdapterTest {

    private static final String BODY = """
            {"status":"OK","results":[
              {"fiscal_year":"2024","fiscal_period":"Q3","end_date":"2024-06-29","filing_date":"2024-08-02",
               "financials":{"income_statement":{
                 "revenues":{"value":85777000000,"unit":"USD"},
                 "net_income_loss":{"value":21448000000,"unit":"USD"},
                 "basic_earnings_per_share":{"value":1.40,"unit":"USD / shares"}}}},
              {"fiscal_year":"2023","fiscal_period":"FY","end_date":"2023-09-30",
               "financials":{"income_statement":{"revenues":{"value":383285000000,"unit":"USD"}}}},
              {"fiscal_year":"2024","fiscal_period":"Q1","end_date":""}
            ]}""";

    @Test
    void fiscalPeriodFyIsAnnual() {
        StubHttp http = new StubHttp(req -> BODY);
        PolygonEarningsAdapter adapter = new PolygonEarningsAdapter(new PolygonClient(http.client(), "k"), new IngestProperties());

        List<EarningsReport> out = adapter.fetch(EntityRef.symbol("AAPL"),
                new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2))).block();

        assertNotNull(out);
        assertEquals(2, out.size());
        EarningsReport q = out.get(0);
        assertEquals(2024, q.getFiscalYear());
        assertEquals(2, q.getFiscalQuarter());
        assertEquals(LocalDate.of(2024, 6, 29), q.getReportedDate());
        assertEquals(1.40, q.getEps());
        assertEquals(21448000000.0, q.getNetIncome());

        EarningsReport fy = out.get(1);
        assertNull(fy.getFiscalQuarter());
        assertEquals(EarningsReport.ANNUAL, fy.getReportType());
        assertEquals("AAPL-2023-annual", fy.naturalKey());
        assertTrue(fy.getProviders().contains("polygon"));
        assertEquals("AAPL", StubHttp.query(http.requests().get(0), "ticker"));
    }

    @Test
    void samePeriodEndAsFmpMergesIntoOneRecord() {
        // AAPL fiscal Q4 2024 ends 2024-09-28, calendar Q3
        StubHttp polygonHttp = new StubHttp(req -> """
                {"status":"OK","results":[
                  {"fiscal_year":"2024","fiscal_period":"Q4","end_date":"2024-09-28",
                   "financials":{"income_statement":{"revenues":{"value":94930000000,"unit":"USD"}}}}]}""");
        StubHttp fmpHttp = new StubHttp(req -> """
                [{"date":"2024-09-28","symbol":"AAPL","period":"Q4","eps":"0.97"}]""");
        DateRange window = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

        List<EarningsReport> fmp = new FmpEarningsAdapter(new FmpClient(fmpHttp.client(), "k"), new IngestProperties())
                .fetch(EntityRef.symbol("AAPL"), window).block();
        List<EarningsReport> polygon = new PolygonEarningsAdapter(new PolygonClient(polygonHttp.client(), "k"), new IngestProperties())
                .fetch(EntityRef.symbol("AAPL"), window).block();
        assertNotNull(fmp);
        assertNotNull(polygon);
        assertEquals("AAPL-2024-3", polygon.get(0).naturalKey());

        List<EarningsReport> partials = new ArrayList<>(fmp);
        partials.addAll(polygon);
        List<EarningsReport> merged = new RecordMerger().merge(new EarningsSchema(), partials);

        assertEquals(1, merged.size());
        EarningsReport r = merged.get(0);
        assertEquals("AAPL-2024-3", r.naturalKey());
        assertEquals("fmp, polygon", r.getDataProvider());
        assertEquals(0.97, r.getEps());
        assertEquals(94930000000.0, r.getRevenue());
    }
}
