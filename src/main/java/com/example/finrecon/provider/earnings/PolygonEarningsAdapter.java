package com.example.finrecon.provider.earnings;

import com.example.finrecon.config.IngestProperties;
import com.example.finrecon.http.PolygonClient;
import com.example.finrecon.http.dto.PolygonFinancials;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.util.ValueParsers;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 회계 기간은 fiscal_year/fiscal_period 를 그대로 쓴다. fiscal_period "FY" 는 연간 보고서(분기 없음).
 */
@Component
@Order(6)
public class PolygonEarningsAdapter extends AbstractEarningsAdapter {

    private final PolygonClient client;

    public PolygonEarningsAdapter(PolygonClient client, IngestProperties props) {
        super(ProviderId.POLYGON, null, props.getEarnings().getLimit());
        this.client = client;
    }

    @Override
    public boolean isEnabled() {
        return client.isEnabled();
    }

    @Override
    protected Mono<List<EarningsReport>> fetchSymbol(String symbol) {
        return guard("financials " + symbol, client.quarterlyFinancials(symbol, limit))
                .map(body -> toReports(symbol, body.getResults()))
                .filter(list -> !list.isEmpty());
    }

    List<EarningsReport> toReports(String symbol, List<PolygonFinancials.Result> results) {
        List<EarningsReport> out = new ArrayList<>();
        for (PolygonFinancials.Result res : mostRecent(results, limit)) {
            // fiscal_year/fiscal_period only tell annual from quarterly; the key follows end_date
            LocalDate end = ValueParsers.day(res.getEndDate());
            boolean annual = "FY".equalsIgnoreCase(res.getFiscalPeriod());
            EarningsReport r = annual ? annualOf(symbol, end) : quarterOf(symbol, end, end);
            if (r == null) continue;
            r.setRevenue(ValueParsers.number(res.incomeValue("revenues")));
            r.setNetIncome(ValueParsers.number(res.incomeValue("net_income_loss")));
            r.setGrossProfit(ValueParsers.number(res.incomeValue("gross_profit")));
            r.setOperatingIncome(ValueParsers.number(res.incomeValue("operating_income_loss")));
            r.setEps(ValueParsers.number(res.incomeValue("basic_earnings_per_share")));
            out.add(r);
        }
        return out;
    }
}
