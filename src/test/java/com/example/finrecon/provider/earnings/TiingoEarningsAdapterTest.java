package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.StubHttp;
import com.example.finrecon.http.TiingoClient;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EntityRef;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TiingoEarningsAdapterTest {

    private static final String BODY = """
            [{"date":"2024-06-29","year":2024,"quarter":3,"statementData":{"incomeStatement":[
                {"dataCode":"revenue","value":85777000000},
                {"dataCode":"netinc","value":21448000000},
                {"dataCode":"eps","value":1.40}]}},
             {"date":"2023-09-30","year":2023,"quarter":0,"statementData":{"incomeStatement":[
                {"dataCode":"revenue","value":383285000000}]}},
             {"date":"bad","year":2023,"quarter":2}]""";

    @Test
    void periodFollowsStatementDate() {
        StubHttp http = new StubHttp(req -> BODY);
        TiingoEarningsAdapter adapter = new TiingoEarningsAdapter(new TiingoClient(http.client(), "k"), new IngestProperties());

        List<EarningsReport> out = adapter.fetch(EntityRef.symbol("AAPL"),
                new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2))).block();

        assertNotNull(out);
        assertEquals(2, out.size());
        // filed as fiscal Q3, but the statement date falls in calendar Q2
        EarningsReport q = out.get(0);
        assertEquals(2024, q.getFiscalYear());
        assertEquals(2, q.getFiscalQuarter());
        assertEquals("AAPL-2024-2", q.naturalKey());
        assertEquals(85777000000.0, q.getRevenue());
        assertEquals(1.40, q.getEps());

        EarningsReport annual = out.get(1);
        assertNull(annual.getFiscalQuarter());
        assertEquals("AAPL-2023-annual", annual.naturalKey());
        assertEquals(EarningsReport.ANNUAL, annual.getReportType());
        assertEquals(383285000000.0, annual.getRevenue());
        assertTrue(http.requests().get(0).url().getPath().contains("/aapl/"));
    }
}
