package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.TwelveDataClient;
import com.example.finrecon.http.dto.TwelveDataEarnings;
import com.example.finrecon.http.dto.TwelveDataIncomeStatement;
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
 * EPS(earnings)와 분기 손익계산서(income_statement)를 회계 기간 기준으로 합친다.
 */
@Component
@Order(4)
public class TwelveDataEarningsAdapter extends AbstractEarningsAdapter {

    private final TwelveDataClient client;

    public TwelveDataEarningsAdapter(TwelveDataClient client, @Qualifier("twelveDataPacer") RequestPacer pacer,
                                     IngestProperties props) {
        super(ProviderId.TWELVE_DATA, pacer, props.getEarnings().getLimit());
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
                    .doOnNext(body -> addEarnings(acc, symbol, body))
                    .then(pacer.pause())
                    .then(guard("income_statement " + symbol, client.quarterlyIncomeStatement(symbol)))
                    .doOnNext(body -> joinIncome(acc, symbol, body))
                    .then(Mono.fromSupplier(() -> acc))
                    .filter(list -> !list.isEmpty());
        });
    }

    void addEarnings(List<EarningsReport> acc, String symbol, TwelveDataEarnings body) {
        if (body.isError()) {
            log.warn("twelve_data earnings skipped for {}: {}", symbol, body.getMessage());
            return;
        }
        for (TwelveDataEarnings.Row row : mostRecent(body.getEarnings(), limit)) {
            EarningsReport r = quarterOf(symbol, ValueParsers.day(row.getDate()), null);
            if (r == null) continue;
            r.setEps(ValueParsers.number(row.getEpsActual()));
            r.setEpsEstimated(ValueParsers.number(row.getEpsEstimate()));
            acc.add(r);
        }
    }

    void joinIncome(List<EarningsReport> acc, String symbol, TwelveDataIncomeStatement body) {
        if (body.isError()) {
            log.warn("twelve_data income_statement skipped for {}: {}", symbol, body.getMessage());
            return;
        }
        for (TwelveDataIncomeStatement.Row row : mostRecent(body.getIncomeStatement(), limit)) {
            EarningsReport r = findOrAdd(acc, symbol, ValueParsers.day(row.getFiscalDate()));
            if (r == null) continue;
            r.setRevenue(ValueParsers.number(row.getSales()));
            r.setNetIncome(ValueParsers.number(row.getNetIncome()));
            r.setGrossProfit(ValueParsers.number(row.getGrossProfit()));
            r.setOperatingIncome(ValueParsers.number(row.getOperatingIncome()));
            r.setEbitda(ValueParsers.number(row.getEbitda()));
        }
    }
}
