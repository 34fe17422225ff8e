package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.TiingoClient;
import com.example.finrecon.http.dto.TiingoStatement;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.util.ValueParsers;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(5)
public class TiingoEarningsAdapter extends AbstractEarningsAdapter {

    private final TiingoClient client;

    public TiingoEarningsAdapter(TiingoClient client, IngestProperties props) {
        super(ProviderId.TIINGO, null, props.getEarnings().getLimit());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EarningsReport>> fetchSymbol(String symbol) {
        return guard("statements " + symbol, client.statements(symbol))
                .map(rows -> toReports(symbol, rows))
                .filter(list -> !list.isEmpty());
    }

    List<EarningsReport> toReports(String symbol, List<TiingoStatement> rows) {
        List<EarningsReport> out = new ArrayList<>();
        for (TiingoStatement row : mostRecent(rows, limit)) {
            LocalDate date = ValueParsers.day(row.getDate());
            // quarter 0 marks the annual statement; the filing's own year/quarter labels are fiscal, not calendar
            boolean annual = row.getQuarter() != null && row.getQuarter() == 0;
            EarningsReport r = annual ? annualOf(symbol, date) : quarterOf(symbol, date, null);
            if (r == null) continue;
            r.setRevenue(ValueParsers.number(row.incomeValue("revenue")));
            r.setNetIncome(ValueParsers.number(row.incomeValue("netinc")));
            r.setGrossProfit(ValueParsers.number(row.incomeValue("grossProfit")));
            r.setOperatingIncome(ValueParsers.number(row.incomeValue("opinc")));
            r.setEbitda(ValueParsers.number(row.incomeValue("ebitda")));
            r.setEps(ValueParsers.number(row.incomeValue("eps")));
            out.add(r);
        }
        return out;
    }
}
