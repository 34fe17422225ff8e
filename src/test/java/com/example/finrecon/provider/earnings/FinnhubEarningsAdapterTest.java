package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FinnhubClient;
import com.example.finrecon.http.StubHttp;
import com.example.finrecon.http.dto.FinnhubFinancialsReported;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.provider.RequestPacer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FinnhubEarningsAdapterTest {

    private static final DateRange ANY = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

    private static final String EARNINGS = """
            [{"symbol":"AAPL","period":"2024-06-30","actual":1.40,"estimate":1.35,"surprise":0.05,"surprisePercent":3.7},
             {"symbol":"AAPL","period":"2024-03-31","actual":1.53,"estimate":1.50}]""";

    private static final String FINANCIALS = """
            {"symbol":"AAPL","data":[
              {"year":2024,"quarter":3,"endDate":"2024-06-29 00:00:00","report":{"ic":[
                {"concept":"us-gaap_Revenues","value":85777000000},
                {"concept":"us-gaap_NetIncomeLoss","value":21448000000},
                {"concept":"us-gaap_GrossProfit","value":39678000000},
                {"concept":"us-gaap_OperatingIncomeLoss","value":25352000000}]}},
              {"year":2023,"quarter":4,"endDate":"2023-09-30","report":{"ic":[
                {"concept":"Revenues","value":89498000000}]}}
            ]}""";

    private FinnhubEarningsAdapter adapter(StubHttp http) {
        return new FinnhubEarningsAdapter(new FinnhubClient(http.client(), "k"), RequestPacer.none(), new IngestProperties());
    }

    @Test
    @DisplayName("EPS 서프라이즈와 재무제표를 같은 회계 분기로 합친다")
    void joinsEarningsAndFinancialsByPeriod() {
        StubHttp http = new StubHttp(req -> req.url().getPath().endsWith("/stock/earnings") ? EARNINGS : FINANCIALS);

        List<EarningsReport> out = adapter(http).fetch(EntityRef.symbol("aapl"), ANY).block();

        assertNotNull(out);
        assertEquals(3, out.size());
        EarningsReport q2 = out.get(0);
        assertEquals("AAPL", q2.getSymbol());
        assertEquals(2024, q2.getFiscalYear());
        assertEquals(2, q2.getFiscalQuarter());
        assertEquals(1.40, q2.getEps());
        assertEquals(1.35, q2.getEpsEstimated());
        assertEquals(85777000000.0, q2.getRevenue());
        assertEquals(25352000000.0, q2.getOperatingIncome());
        assertEquals("quarterly", q2.getReportType());

        EarningsReport added = out.get(2);
        assertEquals(2023, added.getFiscalYear());
        assertEquals(3, added.getFiscalQuarter());
        assertEquals(89498000000.0, added.getRevenue());
        assertNull(added.getEps());
        assertEquals(2, http.requests().size());
    }

    @Test
    void financialsFailureKeepsEarnings() {
        StubHttp http = new StubHttp(req -> req.url().getPath().endsWith("/stock/earnings") ? EARNINGS : null);

        List<EarningsReport> out = adapter(http).fetch(EntityRef.symbol("AAPL"), ANY).block();

        assertNotNull(out);
        assertEquals(2, out.size());
        assertNull(out.get(0).getRevenue());
    }

    @Test
    void bothCallsFailingCompletesEmpty() {
        StubHttp http = new StubHttp(req -> null);

        StepVerifier.create(adapter(http).fetch(EntityRef.symbol("AAPL"), ANY)).verifyComplete();
    }

    @Test
    void indicatorEntityIsIgnored() {
        StubHttp http = new StubHttp(req -> EARNINGS);

        StepVerifier.create(adapter(http).fetch(EntityRef.indicatorSet("US"), ANY)).verifyComplete();
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void conceptMatchesPrefixedNames() {
        List<FinnhubFinancialsReported.LineItem> ic = List.of(
                new FinnhubFinancialsReported.LineItem("us-gaap:GrossProfit", "10"),
                new FinnhubFinancialsReported.LineItem("us-gaap_CostOfRevenues", "3"),
                new FinnhubFinancialsReported.LineItem("Revenues", "20"));

        assertEquals(10.0, FinnhubEarningsAdapter.concept(ic, "GrossProfit"));
        assertEquals(20.0, FinnhubEarningsAdapter.concept(ic, "Revenues"));
        assertNull(FinnhubEarningsAdapter.concept(ic, "NetIncomeLoss"));
    }
}
