package com.example.finrecon.service.merge;

import com.example.finrecon.model.EarningsReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Component
public class EarningsSchema implements RecordSchema<EarningsReport> {

    private static final List<MergeField<EarningsReport, ?>> FIELDS = List.of(
            MergeField.of("symbol", EarningsReport::getSymbol, EarningsReport::setSymbol),
            MergeField.of("fiscalYear", EarningsReport::getFiscalYear, EarningsReport::setFiscalYear),
            MergeField.of("fiscalQuarter", EarningsReport::getFiscalQuarter, EarningsReport::setFiscalQuarter),
            MergeField.of("reportedDate", EarningsReport::getReportedDate, EarningsReport::setReportedDate),
            MergeField.of("reportType", EarningsReport::getReportType, EarningsReport::setReportType),
            MergeField.of("eps", EarningsReport::getEps, EarningsReport::setEps),
            MergeField.of("epsEstimated", EarningsReport::getEpsEstimated, EarningsReport::setEpsEstimated),
            MergeField.of("epsSurprise", EarningsReport::getEpsSurprise, EarningsReport::setEpsSurprise),
            MergeField.of("epsSurprisePercent", EarningsReport::getEpsSurprisePercent, EarningsReport::setEpsSurprisePercent),
            MergeField.of("revenue", EarningsReport::getRevenue, EarningsReport::setRevenue),
            MergeField.of("revenueEstimated", EarningsReport::getRevenueEstimated, EarningsReport::setRevenueEstimated),
            MergeField.of("revenueSurprise", EarningsReport::getRevenueSurprise, EarningsReport::setRevenueSurprise),
            MergeField.of("revenueSurprisePercent", EarningsReport::getRevenueSurprisePercent, EarningsReport::setRevenueSurprisePercent),
            MergeField.of("netIncome", EarningsReport::getNetIncome, EarningsReport::setNetIncome),
            MergeField.of("grossProfit", EarningsReport::getGrossProfit, EarningsReport::setGrossProfit),
            MergeField.of("operatingIncome", EarningsReport::getOperatingIncome, EarningsReport::setOperatingIncome),
            MergeField.of("ebitda", EarningsReport::getEbitda, EarningsReport::setEbitda),
            MergeField.of("operatingMargin", EarningsReport::getOperatingMargin, EarningsReport::setOperatingMargin),
            MergeField.of("netMargin", EarningsReport::getNetMargin, EarningsReport::setNetMargin),
            MergeField.of("yearOverYearEpsGrowth", EarningsReport::getYearOverYearEpsGrowth, EarningsReport::setYearOverYearEpsGrowth),
            MergeField.of("yearOverYearRevenueGrowth", EarningsReport::getYearOverYearRevenueGrowth, EarningsReport::setYearOverYearRevenueGrowth),
            MergeField.of("guidance", EarningsReport::getGuidance, EarningsReport::setGuidance),
            MergeField.of("nextYearEpsGuidance", EarningsReport::getNextYearEpsGuidance, EarningsReport::setNextYearEpsGuidance),
            MergeField.of("nextYearRevenueGuidance", EarningsReport::getNextYearRevenueGuidance, EarningsReport::setNextYearRevenueGuidance),
            MergeField.of("conferenceCallDate", EarningsReport::getConferenceCallDate, EarningsReport::setConferenceCallDate),
            MergeField.of("transcriptUrl", EarningsReport::getTranscriptUrl, EarningsReport::setTranscriptUrl),
            MergeField.of("audioUrl", EarningsReport::getAudioUrl, EarningsReport::setAudioUrl),
            MergeField.of("epsBeatMissMet", EarningsReport::getEpsBeatMissMet, EarningsReport::setEpsBeatMissMet),
            MergeField.of("revenueBeatMissMet", EarningsReport::getRevenueBeatMissMet, EarningsReport::setRevenueBeatMissMet)
    );

    @Override
    public List<MergeField<EarningsReport, ?>> fields() {
        return FIELDS;
    }

    @Override
    public EarningsReport newRecord() {
        return new EarningsReport();
    }

    @Override
    public void applyDefaults(EarningsReport r) {
        if (MergeField.absent(r.getReportType())) {
            r.setReportType(r.getFiscalQuarter() == null ? EarningsReport.ANNUAL : "quarterly");
        }
    }

    @Override
    public void deriveRecordMetrics(EarningsReport r) {
        if (r.getEps() != null && r.getEpsEstimated() != null) {
            if (r.getEpsSurprise() == null) r.setEpsSurprise(DerivedMetrics.surprise(r.getEps(), r.getEpsEstimated()));
            if (r.getEpsSurprisePercent() == null) {
                r.setEpsSurprisePercent(DerivedMetrics.surprisePercent(r.getEpsSurprise(), r.getEpsEstimated()));
            }
        }
        if (r.getEpsBeatMissMet() == null) r.setEpsBeatMissMet(DerivedMetrics.beatMissMet(r.getEpsSurprise()));

        if (r.getRevenue() != null && r.getRevenueEstimated() != null) {
            if (r.getRevenueSurprise() == null) r.setRevenueSurprise(DerivedMetrics.surprise(r.getRevenue(), r.getRevenueEstimated()));
            if (r.getRevenueSurprisePercent() == null) {
                r.setRevenueSurprisePercent(DerivedMetrics.surprisePercent(r.getRevenueSurprise(), r.getRevenueEstimated()));
            }
        }
        if (r.getRevenueBeatMissMet() == null) r.setRevenueBeatMissMet(DerivedMetrics.beatMissMet(r.getRevenueSurprise()));

        if (r.getOperatingMargin() == null) r.setOperatingMargin(DerivedMetrics.ratio(r.getOperatingIncome(), r.getRevenue()));
        if (r.getNetMargin() == null) r.setNetMargin(DerivedMetrics.ratio(r.getNetIncome(), r.getRevenue()));
    }

    /** 같은 분기의 전년도 레코드와 비교해 EPS/매출 성장률을 채운다. */
    @Override
    public void deriveSeriesMetrics(List<EarningsReport> newestFirst) {
        for (EarningsReport current : newestFirst) {
            if (current.getFiscalYear() == null) continue;
            EarningsReport prior = findPeriod(newestFirst, current.getFiscalYear() - 1, current.getFiscalQuarter());
            if (prior == null) continue;
            if (current.getYearOverYearEpsGrowth() == null) {
                current.setYearOverYearEpsGrowth(DerivedMetrics.changePercent(current.getEps(), prior.getEps()));
            }
            if (current.getYearOverYearRevenueGrowth() == null) {
                current.setYearOverYearRevenueGrowth(DerivedMetrics.changePercent(current.getRevenue(), prior.getRevenue()));
            }
        }
    }

    private static EarningsReport findPeriod(List<EarningsReport> series, int fiscalYear, Integer fiscalQuarter) {
        for (EarningsReport r : series) {
            if (r.getFiscalYear() != null && r.getFiscalYear() == fiscalYear && Objects.equals(r.getFiscalQuarter(), fiscalQuarter)) {
                return r;
            }
        }
        return null;
    }

    @Override
    public List<String> conflictKey() {
        return List.of("symbol", "fiscalYear", "fiscalQuarter", "dataProvider");
    }

    @Override
    public String conflictId(EarningsReport r) {
        return String.join("|", r.getSymbol(), String.valueOf(r.getFiscalYear()), r.periodMarker(), r.getDataProvider());
    }
}
