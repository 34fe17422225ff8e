package com.example.finrecon.service;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.exception.NoProviderConfiguredException;
import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.IngestSummary;
import com.example.finrecon.provider.IndicatorProvider;
import com.example.finrecon.service.cache.QueryCacheEvictor;
import com.example.finrecon.service.merge.IndicatorSchema;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 경제 지표 수집: 오늘 기준 앞뒤 기간에 대해 모든 지표 제공자를 한 번에 settle 하고 병합 결과를 저장한다.
 */
@Service
@RequiredArgsConstructor
public class IndicatorIngestService {

    private static final Logger log = LoggerFactory.getLogger(IndicatorIngestService.class);

    static final String COMPLETED = "Economic indicators multi-provider fetch completed";

    private final List<IndicatorProvider> adapters;
    private final ReconciliationPipeline pipeline;
    private final IndicatorSchema schema;
    private final RecordSink<EconomicIndicator> indicatorSink;
    private final IngestProperties props;
    private final Clock clock;
    private final QueryCacheEvictor cacheEvictor;

    public Mono<IngestSummary> run() {
        return run(props.getIndicators().getCountry());
    }

    public Mono<IngestSummary> run(String country) {
        return Mono.defer(() -> {
            List<IndicatorProvider> enabled = adapters.stream().filter(IndicatorProvider::isEnabled).toList();
            if (enabled.isEmpty()) return Mono.error(new NoProviderConfiguredException("economic indicator"));

            IngestProperties.Indicators cfg = props.getIndicators();
            DateRange window = DateRange.around(LocalDate.now(clock), cfg.getLookbackDays(), cfg.getLookaheadDays());
            EntityRef ref = EntityRef.indicatorSet(country == null || country.isBlank() ? cfg.getCountry() : country);
            log.info("Fetching economic indicators for {} from {} to {} ({} provider(s))",
                    ref.getValue(), window.getFrom(), window.getTo(), enabled.size());

            return pipeline.run(ref, window, enabled, schema, indicatorSink)
                    .flatMap(result -> result.stored()
                            ? cacheEvictor.indicatorsStored(ref.getValue()).thenReturn(result)
                            : Mono.just(result))
                    .map(result -> summarize(result, window));
        });
    }

    static IngestSummary summarize(PipelineResult<EconomicIndicator> result, DateRange window) {
        IngestSummary s = new IngestSummary();
        s.setMessage(COMPLETED);
        s.setDateRange(window);
        s.setProviders(result.settled().outcomes());
        IngestSummary.Counts c = s.getSummary();
        if (result.stored()) {
            c.setSuccessfulProviders(result.settled().succeeded());
            c.setTotalRecords(result.merged().size());
            c.setErrors(0);
            log.info("Stored {} economic indicator(s) from {} provider(s)", c.getTotalRecords(), c.getSuccessfulProviders());
        } else if (result.outcome() == PipelineResult.Outcome.NO_PROVIDER_DATA) {
            c.setSuccessfulProviders(0);
            c.setErrors(result.settled().dispatched());
        } else {
            c.setSuccessfulProviders(0);
            c.setErrors(1);
            log.error("Economic indicator run failed: {}", result.outcome().message());
        }
        s.setSuccess(c.getTotalRecords() > 0);
        if (!s.isSuccess()) s.setMessage(COMPLETED + ": " + result.outcome().message());
        return s;
    }
}
