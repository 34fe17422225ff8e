package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FinnhubClient;
import com.example.finrecon.http.dto.FinnhubEconomicSeries;
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
@Order(4)
public class FinnhubIndicatorAdapter extends AbstractIndicatorAdapter {

    static final List<String> CODES = List.of("US-CPI", "US-GDP", "US-UNRATE", "US-FEDRATE");

    private final FinnhubClient client;

    public FinnhubIndicatorAdapter(FinnhubClient client, @Qualifier("finnhubPacer") RequestPacer pacer,
                                   IndicatorClassifier classifier, IngestProperties props) {
        super(ProviderId.FINNHUB, pacer, classifier, props.getIndicators().getMaxPoints());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window) {
        return gather(CODES, code -> client.economic(code)
                .filter(series -> series.getCode() != null && series.getData() != null)
                .map(series -> toIndicators(series.getData(), FinnhubEconomicSeries.Point::getPeriod,
                        FinnhubEconomicSeries.Point::getValue, window, code.substring("US-".length()), country, "Finnhub")));
    }
}
