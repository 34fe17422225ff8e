package com.example.finrecon.provider.indicator;

import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.IndicatorMetadata;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.provider.AbstractProviderAdapter;
import com.example.finrecon.provider.IndicatorProvider;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.service.IndicatorClassifier;
import com.example.finrecon.util.ValueParsers;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 기간 기반 지표 어댑터의 공통 매핑. 기간(window) 밖의 관측치는 버리고, 시리즈당 최대 maxPoints 개만 남긴다.
 */
public abstract class AbstractIndicatorAdapter extends AbstractProviderAdapter<EconomicIndicator> implements IndicatorProvider {

    static final String US = "US";

    protected final IndicatorClassifier classifier;
    protected final int maxPoints;

    protected AbstractIndicatorAdapter(ProviderId id, RequestPacer pacer, IndicatorClassifier classifier, int maxPoints) {
        super(id, pacer);
        this.classifier = classifier;
        this.maxPoints = maxPoints;
    }

    @Override
    public final Mono<List<EconomicIndicator>> fetch(EntityRef ref, DateRange window) {
        if (!isEnabled()) return Mono.empty();
        String country = ref.getValue();
        if (!supportsCountry(country)) {
            log.debug("{} has no series for country {}", id().code(), country);
            return Mono.empty();
        }
        return fetchSeries(country, window);
    }

    /** US-only by default. */
    protected boolean supportsCountry(String country) {
        return US.equalsIgnoreCase(country);
    }

    /** USD for US series; other countries are left unset since the providers do not report a currency. */
    static String currencyOf(String country) {
        return US.equalsIgnoreCase(country) ? "USD" : null;
    }

    protected abstract Mono<List<EconomicIndicator>> fetchSeries(String country, DateRange window);

    /**
     * Maps raw observations of one series, keeping those dated inside the window with a parseable value,
     * at most {@link #maxPoints} of them in provider order.
     */
    protected <P> List<EconomicIndicator> toIndicators(List<P> rows, Function<P, String> date, Function<P, String> value,
                                                       DateRange window, String rawCode, String country, String agency) {
        List<EconomicIndicator> out = new ArrayList<>();
        if (rows == null) return out;
        IndicatorMetadata meta = classifier.classify(rawCode);
        for (P row : rows) {
            if (out.size() >= maxPoints) break;
            LocalDate day = ValueParsers.day(date.apply(row));
            if (!window.contains(day)) continue;
            Double v = ValueParsers.number(value.apply(row));
            if (v == null) continue;
            out.add(observation(meta, country, day, v, agency));
        }
        return out;
    }

    protected EconomicIndicator observation(IndicatorMetadata meta, String country, LocalDate day, Double value, String agency) {
        EconomicIndicator r = new EconomicIndicator();
        r.setIndicatorCode(meta.getStandardCode());
        r.setIndicatorName(meta.getDisplayName());
        r.setCountry(country);
        r.setValue(value);
        r.setPeriodDate(day);
        r.setPeriodType(meta.getPeriodType());
        r.setFrequency(meta.getFrequency());
        r.setUnit(meta.getUnit());
        r.setCurrency(currencyOf(country));
        r.setSeasonalAdjustment(Boolean.TRUE);
        r.setPreliminary(Boolean.FALSE);
        r.setImportanceLevel(meta.getImportance());
        r.setMarketImpact(meta.getMarketImpact());
        r.setReleaseDate(day);
        r.setSourceAgency(agency);
        r.setStatus("final");
        r.setRevisionCount(0);
        return stamp(r);
    }
}
