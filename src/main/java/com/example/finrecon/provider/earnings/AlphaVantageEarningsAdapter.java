package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.AlphaVantageClient;
import com.example.finrecon.http.dto.AlphaVantageEarnings;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.service.merge.DerivedMetrics;
import com.example.finrecon.util.ValueParsers;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * 분기 EPS 실적/예상/서프라이즈. 회계 기간은 fiscalDateEnding 기준, 보고일은 reportedDate.
 */
@Component
@Order(2)
public class AlphaVantageEarningsAdapter extends AbstractEarningsAdapter {

    private final AlphaVantageClient client;

    public AlphaVantageEarningsAdapter(AlphaVantageClient client, IngestProperties props) {
        super(ProviderId.ALPHA_VANTAGE, null, props.getEarnings().getLimit());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EarningsReport>> fetchSymbol(String symbol) {
        return guard("EARNINGS " + symbol, client.earnings(symbol))
                .flatMap(body -> {
                    String err = body.providerError();
                    if (err != null) {
                        log.warn("alpha_vantage EARNINGS skipped for {}: {}", symbol, err);
                        return Mono.empty();
                    }
                    List<EarningsReport> out = toReports(symbol, body.getQuarterlyEarnings());
                    return out.isEmpty() ? Mono.empty() : Mono.just(out);
                });
    }

    List<EarningsReport> toReports(String symbol, List<AlphaVantageEarnings.Quarter> quarters) {
        List<EarningsReport> out = new ArrayList<>();
        for (AlphaVantageEarnings.Quarter q : mostRecent(quarters, limit)) {
            EarningsReport r = quarterOf(symbol, ValueParsers.day(q.getFiscalDateEnding()), ValueParsers.day(q.getReportedDate()));
            if (r == null) continue;
            r.setEps(ValueParsers.number(q.getReportedEPS()));
            r.setEpsEstimated(ValueParsers.number(q.getEstimatedEPS()));
            r.setEpsSurprise(ValueParsers.number(q.getSurprise()));
            r.setEpsSurprisePercent(ValueParsers.number(q.getSurprisePercentage()));
            r.setEpsBeatMissMet(DerivedMetrics.beatMissMet(r.getEpsSurprise()));
            out.add(r);
        }
        return out;
    }
}
