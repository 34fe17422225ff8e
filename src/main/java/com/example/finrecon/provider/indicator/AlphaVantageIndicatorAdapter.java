package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.AlphaVantageClient;
import com.example.finrecon.http.dto.AlphaVantageSeries;
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
@Order(2)
public class AlphaVantageIndicatorAdapter extends AbstractIndicatorAdapter {

    static final List<String> FUNCTIONS = List.of("REAL_GDP", "CPI", "UNEMPLOYMENT", "FEDERAL_FUNDS_RATE");

    private final AlphaVantageClient client;

    public AlphaVantageIndicatorAdapter(AlphaVantageClient client, @Qualifier("alphaVantagePacer") RequestPacer pacer,
                                        IndicatorClassifier classifier, IngestProperties props) {
        super(ProviderId.ALPHA_VANTAGE, pacer, classifier, props.getIndicators().getMaxPoints());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window) {
        return gather(FUNCTIONS, function -> client.economicSeries(function)
                .flatMap(series -> {
                    String err = series.providerError();
                    if (err != null) {
                        log.warn("alpha_vantage {} skipped: {}", function, err);
                        return Mono.empty();
                    }
                    return Mono.just(toIndicators(series.getData(), AlphaVantageSeries.Point::getDate,
                            AlphaVantageSeries.Point::getValue, window, function, country, agencyOf(function)));
                }));
    }

    static String agencyOf(String function) {
        if (function.contains("GDP")) return "BEA";
        if (function.contains("UNEMPLOYMENT")) return "BLS";
        return "Federal Reserve";
    }
}
