package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.FmpClient;
import com.example.finrecon.http.dto.FmpIncomeStatement;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.util.ValueParsers;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/** 분기 손익계산서(매출, 순이익, 매출총이익, 영업이익, EBITDA, EPS). */
@Component
@Order(1)
public class FmpEarningsAdapter extends AbstractEarningsAdapter {

    private final FmpClient client;

    public FmpEarningsAdapter(FmpClient client, IngestProperties props) {
        super(ProviderId.FMP, null, props.getEarnings().getLimit());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EarningsReport>> fetchSymbol(String symbol) {
        return guard("income-statement " + symbol, client.quarterlyIncomeStatements(symbol, limit))
                .map(rows -> toReports(symbol, rows))
                .filter(list -> !list.isEmpty());
    }

    List<EarningsReport> toReports(String symbol, List<FmpIncomeStatement> rows) {
        List<EarningsReport> out = new ArrayList<>();
        for (FmpIncomeStatement row : mostRecent(rows, limit)) {
            EarningsReport r = quarterOf(symbol, ValueParsers.day(row.getDate()), null);
            if (r == null) continue;
            r.setRevenue(ValueParsers.number(row.getRevenue()));
            r.setNetIncome(ValueParsers.number(row.getNetIncome()));
            r.setGrossProfit(ValueParsers.number(row.getGrossProfit()));
            r.setOperatingIncome(ValueParsers.number(row.getOperatingIncome()));
            r.setEbitda(ValueParsers.number(row.getEbitda()));
            r.setEps(ValueParsers.number(row.getEps()));
            out.add(r);
        }
        return out;
    }
}
