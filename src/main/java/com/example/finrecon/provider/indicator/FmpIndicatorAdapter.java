package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FmpClient;
import com.example.finrecon.http.dto.FmpEconomicPoint;
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

@Component
@Order(1)
public class FmpIndicatorAdapter extends AbstractIndicatorAdapter {

    static final List<String> NAMES = List.of("GDP", "CPI", "unemploymentRate");

    private final FmpClient client;

    public FmpIndicatorAdapter(FmpClient client, @Qualifier("fmpPacer") RequestPacer pacer,
                               IndicatorClassifier classifier, IngestProperties props) {
        super(ProviderId.FMP, pacer, classifier, props.getIndicators().getMaxPoints());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window) {
        return gather(NAMES, name -> client.economic(name)
                .map(rows -> toIndicators(rows, FmpEconomicPoint::getDate, FmpEconomicPoint::getValue,
                        window, name, country, "BEA/BLS")));
    }
}
