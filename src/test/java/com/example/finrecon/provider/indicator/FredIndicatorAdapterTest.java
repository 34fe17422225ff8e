package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FredClient;
import com.example.finrecon.http.StubHttp;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.service.IndicatorClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FredIndicatorAdapterTest {

    private static final DateRange WINDOW = new DateRange(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 31));

    private static final String UNRATE = """
            {"observations":[
              {"date":"2024-06-01","value":"4.1"},
              {"date":"2024-05-01","value":"4.0"},
              {"date":"2024-05-15","value":"."},
              {"date":"2024-04-01","value":"3.9"}
            ]}""";

    private static final String HOUST = """
            {"observations":[{"date":"2024-05-01","value":"1,277"}]}""";

    private FredIndicatorAdapter adapter(StubHttp http, String apiKey) {
        return new FredIndicatorAdapter(new FredClient(http.client(), apiKey), RequestPacer.none(),
                new IndicatorClassifier(), new IngestProperties());
    }

    @Test
    @DisplayName("기간 밖 관측치와 '.' 값은 버리고 라벨로 분류한다")
    void mapsObservationsInsideWindow() {
        StubHttp http = new StubHttp(req -> {
            String series = StubHttp.query(req, "series_id");
            if ("UNRATE".equals(series)) return UNRATE;
            if ("HOUST".equals(series)) return HOUST;
            return "{\"observations\":[]}";
        });

        List<EconomicIndicator> out = adapter(http, "k").fetch(EntityRef.indicatorSet("US"), WINDOW).block();

        assertNotNull(out);
        assertEquals(2, out.size());
        EconomicIndicator unrate = out.get(0);
        assertEquals("UNEMPLOYMENT", unrate.getIndicatorCode());
        assertEquals(4.0, unrate.getValue());
        assertEquals(LocalDate.of(2024, 5, 1), unrate.getPeriodDate());
        assertEquals("Federal Reserve", unrate.getSourceAgency());
        assertEquals("USD", unrate.getCurrency());
        assertEquals(List.of("fred"), List.copyOf(unrate.getProviders()));

        EconomicIndicator houst = out.get(1);
        assertEquals("HOUSING_STARTS", houst.getIndicatorCode());
        assertEquals(1277.0, houst.getValue());
        assertEquals(FredIndicatorAdapter.SERIES.size(), http.requests().size());
    }

    @Test
    @DisplayName("일부 시리즈 호출 실패는 나머지 결과에 영향을 주지 않는다")
    void failedSeriesIsIsolated() {
        StubHttp http = new StubHttp(req -> "UNRATE".equals(StubHttp.query(req, "series_id")) ? UNRATE : null);

        List<EconomicIndicator> out = adapter(http, "k").fetch(EntityRef.indicatorSet("US"), WINDOW).block();

        assertNotNull(out);
        assertEquals(1, out.size());
    }

    @Test
    void emptyWhenNothingInWindow() {
        StubHttp http = new StubHttp(req -> "{\"observations\":[]}");

        StepVerifier.create(adapter(http, "k").fetch(EntityRef.indicatorSet("US"), WINDOW))
                .verifyComplete();
    }

    @Test
    void disabledWithoutApiKey() {
        StubHttp http = new StubHttp(req -> UNRATE);
        FredIndicatorAdapter adapter = adapter(http, " ");

        assertFalse(adapter.isEnabled());
        StepVerifier.create(adapter.fetch(EntityRef.indicatorSet("US"), WINDOW)).verifyComplete();
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void nonUsCountryIsSkipped() {
        StubHttp http = new StubHttp(req -> UNRATE);

        StepVerifier.create(adapter(http, "k").fetch(EntityRef.indicatorSet("DE"), WINDOW)).verifyComplete();
        assertTrue(http.requests().isEmpty());
    }

    @Test
    void respectsMaxPoints() {
        StringBuilder sb = new StringBuilder("{\"observations\":[");
        for (int d = 1; d <= 20; d++) {
            if (d > 1) sb.append(',');
            sb.append(String.format("{\"date\":\"2024-05-%02d\",\"value\":\"%d\"}", d, d));
        }
        String body = sb.append("]}").toString();
        StubHttp http = new StubHttp(req -> "GDP".equals(StubHttp.query(req, "series_id")) ? body : "{\"observations\":[]}");
        IngestProperties props = new IngestProperties();
        props.getIndicators().setMaxPoints(3);
        FredIndicatorAdapter adapter = new FredIndicatorAdapter(new FredClient(http.client(), "k"), RequestPacer.none(),
                new IndicatorClassifier(), props);

        List<EconomicIndicator> out = adapter.fetch(EntityRef.indicatorSet("US"), WINDOW).block();

        assertNotNull(out);
        assertEquals(3, out.size());
    }
}
