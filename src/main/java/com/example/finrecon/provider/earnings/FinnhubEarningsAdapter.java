package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FinnhubClient;
import com.example.finrecon.http.dto.FinnhubEarningsSurprise;
import com.example.finrecon.http.dto.FinnhubFinancialsReported;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.util.ValueParsers;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * EPS 서프라이즈(stock/earnings)와 보고 재무제표(stock/financials-reported)를 회계 기간 기준으로 합친다.
 */
@Component
@Order(3)
public class FinnhubEarningsAdapter extends AbstractEarningsAdapter {

    private final FinnhubClient client;

    public FinnhubEarningsAdapter(FinnhubClient client, @Qualifier("finnhubPacer") RequestPacer pacer, IngestProperties props) {
        super(ProviderId.FINNHUB, pacer, props.getEarnings().getLimit());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EarningsReport>> fetchSymbol(String symbol) {
        return Mono.defer(() -> {
            List<EarningsReport> acc = new ArrayList<>();
            return guard("earnings " + symbol, client.earnings(symbol))
                    .doOnNext(rows -> addSurprises(acc, symbol, rows))
                    .then(pacer.pause())
                    .then(guard("financials-reported " + symbol, client.quarterlyFinancialsReported(symbol)))
                    .doOnNext(body -> joinFinancials(acc, symbol, body))
                    .then(Mono.fromSupplier(() -> acc))
                    .filter(list -> !list.isEmpty());
        });
    }

    void addSurprises(List<EarningsReport> acc, String symbol, List<FinnhubEarningsSurprise> rows) {
        for (FinnhubEarningsSurprise row : mostRecent(rows, limit)) {
            EarningsReport r = quarterOf(symbol, ValueParsers.day(row.getPeriod()), null);
            if (r == null) continue;
            r.setEps(ValueParsers.number(row.getActual()));
            r.setEpsEstimated(ValueParsers.number(row.getEstimate()));
            acc.add(r);
        }
    }

    void joinFinancials(List<EarningsReport> acc, String symbol, FinnhubFinancialsReported body) {
        if (body == null || body.getData() == null) return;
        for (FinnhubFinancialsReported.Filing filing : mostRecent(body.getData(), limit)) {
            if (filing.getReport() == null || filing.getReport().getIc() == null) continue;
            EarningsReport r = findOrAdd(acc, symbol, ValueParsers.day(filing.getEndDate()));
            if (r == null) continue;
            List<FinnhubFinancialsReported.LineItem> ic = filing.getReport().getIc();
            r.setRevenue(concept(ic, "Revenues"));
            r.setNetIncome(concept(ic, "NetIncomeLoss"));
            r.setGrossProfit(concept(ic, "GrossProfit"));
            r.setOperatingIncome(concept(ic, "OperatingIncomeLoss"));
        }
    }

    /** Matches both bare concepts and taxonomy-prefixed ones such as {@code us-gaap_Revenues}. */
    static Double concept(List<FinnhubFinancialsReported.LineItem> ic, String name) {
        for (FinnhubFinancialsReported.LineItem item : ic) {
            String c = item.getConcept();
            if (c == null) continue;
            if (c.equals(name) || c.endsWith("_" + name) || c.endsWith(":" + name)) {
                return ValueParsers.number(item.getValue());
            }
        }
        return null;
    }
}
