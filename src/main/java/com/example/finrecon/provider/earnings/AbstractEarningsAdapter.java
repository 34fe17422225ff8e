package com.example.finrecon.provider.earnings;

import com.example.finrecon.model.DateRange;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EntityRef;
import com.example.finrecon.model.ProviderId;
import com.example.finrecon.provider.AbstractProviderAdapter;
import com.example.finrecon.provider.EarningsProvider;
import com.example.finrecon.provider.RequestPacer;
import com.example.finrecon.util.ValueParsers;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * 심볼 기반 실적 어댑터의 공통 부분. 기간 창 대신 최근 {@code limit} 개 기간만 사용한다.
 */
public abstract class AbstractEarningsAdapter extends AbstractProviderAdapter<EarningsReport> implements EarningsProvider {

    static final String QUARTERLY = "quarterly";

    protected final int limit;

    protected AbstractEarningsAdapter(ProviderId id, RequestPacer pacer, int limit) {
        super(id, pacer);
        this.limit = limit;
    }

    @Override
    public final Mono<List<EarningsReport>> fetch(EntityRef ref, DateRange window) {
        if (!isEnabled() || ref.getKind() != EntityRef.Kind.SYMBOL) return Mono.empty();
        return fetchSymbol(ref.getValue());
    }

    protected abstract Mono<List<EarningsReport>> fetchSymbol(String symbol);

    /**
     * Quarterly partial whose fiscal year and quarter come from {@code periodDate}
     * (quarter = ceil(month / 3)). Null when the date is missing or malformed.
     */
    protected EarningsReport quarterOf(String symbol, LocalDate periodDate, LocalDate reportedDate) {
        if (periodDate == null) return null;
        EarningsReport r = new EarningsReport();
        r.setSymbol(symbol);
        r.setFiscalYear(periodDate.getYear());
        r.setFiscalQuarter(ValueParsers.quarterOf(periodDate));
        r.setReportedDate(reportedDate == null ? periodDate : reportedDate);
        r.setReportType(QUARTERLY);
        return stamp(r);
    }

    /**
     * Annual partial keyed by the calendar year of {@code periodDate}. Provider fiscal-year labels are not used for
     * the key, so every source files the same period end under the same year.
     */
    protected EarningsReport annualOf(String symbol, LocalDate periodDate) {
        EarningsReport r = quarterOf(symbol, periodDate, null);
        if (r == null) return null;
        r.setFiscalQuarter(null);
        r.setReportType(EarningsReport.ANNUAL);
        return r;
    }

    /** Record of the same fiscal period already collected from this provider, or a new one appended to {@code acc}. */
    protected EarningsReport findOrAdd(List<EarningsReport> acc, String symbol, LocalDate periodDate) {
        if (periodDate == null) return null;
        Integer year = periodDate.getYear();
        Integer quarter = ValueParsers.quarterOf(periodDate);
        for (EarningsReport r : acc) {
            if (Objects.equals(r.getFiscalYear(), year) && Objects.equals(r.getFiscalQuarter(), quarter)) return r;
        }
        EarningsReport created = quarterOf(symbol, periodDate, periodDate);
        acc.add(created);
        return created;
    }

    protected static <T> List<T> mostRecent(List<T> rows, int n) {
        if (rows == null) return List.of();
        return rows.size() <= n ? rows : rows.subList(0, n);
    }
}
