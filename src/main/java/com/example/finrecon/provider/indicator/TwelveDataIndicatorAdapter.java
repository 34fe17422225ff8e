package com.example.finrecon.provider.indicator;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.TwelveDataClient;
import com.example.finrecon.http.dto.TwelveDataEconomicSeries;
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
@Order(5)
public class TwelveDataIndicatorAdapter extends AbstractIndicatorAdapter {

    static final List<String> INDICATORS = List.of("GDP", "CPI", "UNEMPLOYMENT_RATE");

    private final TwelveDataClient client;

    public TwelveDataIndicatorAdapter(TwelveDataClient client, @Qualifier("twelveDataPacer") RequestPacer pacer,
                                      IndicatorClassifier classifier, IngestProperties props) {
        super(ProviderId.TWELVE_DATA, pacer, classifier, props.getIndicators().getMaxPoints());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    /** 국가 파라미터를 받는 유일한 지표 소스 */
    @Override
    protected boolean supportsCountry(String country) {
        return country != null && !country.isBlank();
    }

    @Override
    protected Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window) {
        return gather(INDICATORS, indicator -> client.economicIndicator(indicator, country)
                .flatMap(series -> {
                    if (series.isError() || series.getValues() == null) {
                        log.warn("twelve_data {} skipped: {}", indicator, series.getMessage());
                        return Mono.empty();
                    }
                    return Mono.just(toIndicators(series.getValues(), TwelveDataEconomicSeries.Point::getDatetime,
                            TwelveDataEconomicSeries.Point::getValue, window, indicator, country, "Twelve Data"));
                }));
    }
}
