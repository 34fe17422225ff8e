package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.StubHttp;
import com.example.finrecon.http.TwelveDataClient;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.service.IndicatorClassifier;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TwelveDataIndicatorAdapterTest {

    @Test
    void servesAnyCountryAndSkipsErrorBodies() {
        StubHttp http = new StubHttp(req -> "CPI".equals(StubHttp.query(req, "indicator"))
                ? "{\"values\":[{\"datetime\":\"2024-04-01\",\"value\":\"2.2\"}],\"status\":\"ok\"}"
                : "{\"status\":\"error\",\"message\":\"**symbol** not found\"}");
        TwelveDataIndicatorAdapter adapter = new TwelveDataIndicatorAdapter(new TwelveDataClient(http.client(), "k"),
                RequestPacer.none(), new IndicatorClassifier(), new IngestProperties());

        List<EconomicIndicator> out = adapter.fetch(EntityRef.indicatorSet("de"),
                new DateRange(LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 30))).block();

        assertNotNull(out);
        assertEquals(1, out.size());
        assertEquals("DE", out.get(0).getCountry());
        assertEquals("CPI", out.get(0).getIndicatorCode());
        assertNull(out.get(0).getCurrency());
        assertEquals("DE", StubHttp.query(http.requests().get(0), "country"));
        assertEquals(3, http.requests().size());
    }
}
