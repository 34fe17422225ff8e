package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FredClient;
import com.example.finrecon.http.dto.FredObservations;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.service.IndicatorClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * FRED 시리즈 관측치. 시리즈 ID 만으로는 분류가 안 되는 경우(INDPRO, RSXFS, HOUST)가 있어 분류용 라벨을 함께 둔다.
 */
@Component
@Order(3)
public class FredIndicatorAdapter extends AbstractIndicatorAdapter {

    static final List<Series> SERIES = List.of(
            new Series("GDP", "GDP"),
            new Series("CPIAUCSL", "CPI"),
            new Series("UNRATE", "UNRATE"),
            new Series("FEDFUNDS", "FEDFUNDS"),
            new Series("INDPRO", "INDUSTRIAL_PRODUCTION"),
            new Series("RSXFS", "RETAIL_SALES"),
            new Series("HOUST", "HOUSING_STARTS")
    );

    private final FredClient client;

    public FredIndicatorAdapter(FredClient client, @Qualifier("fredPacer") RequestPacer pacer,
                                IndicatorClassifier classifier, IngestProperties props) {
        super(ProviderId.FRED, pacer, classifier, props.getIndicators().getMaxPoints());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window) {
        return gather(SERIES, s -> client.observations(s.id, window.getFrom(), window.getTo(), maxPoints)
                .map(obs -> toIndicators(obs.getObservations(), FredObservations.Observation::getDate,
                        FredObservations.Observation::getValue, window, s.label, country, "Federal Reserve")));
    }

    static final class Series {
        final String id;
        final String label;

        Series(String id, String label) {
            this.id = id;
            this.label = label;
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
