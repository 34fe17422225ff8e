package com.example.finrecon.service.merge;

import com.example.finrecon.model.EconomicIndicator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class IndicatorSchema implements RecordSchema<EconomicIndicator> {

    private static final List<MergeField<EconomicIndicator, ?>> FIELDS = List.of(
            MergeField.of("indicatorCode", EconomicIndicator::getIndicatorCode, EconomicIndicator::setIndicatorCode),
            MergeField.of("indicatorName", EconomicIndicator::getIndicatorName, EconomicIndicator::setIndicatorName),
            MergeField.of("country", EconomicIndicator::getCountry, EconomicIndicator::setCountry),
            MergeField.of("value", EconomicIndicator::getValue, EconomicIndicator::setValue),
            MergeField.of("previousValue", EconomicIndicator::getPreviousValue, EconomicIndicator::setPreviousValue),
            MergeField.of("changeValue", EconomicIndicator::getChangeValue, EconomicIndicator::setChangeValue),
            MergeField.of("changePercent", EconomicIndicator::getChangePercent, EconomicIndicator::setChangePercent),
            MergeField.of("yearOverYearChange", EconomicIndicator::getYearOverYearChange, EconomicIndicator::setYearOverYearChange),
            MergeField.of("periodDate", EconomicIndicator::getPeriodDate, EconomicIndicator::setPeriodDate),
            MergeField.of("periodType", EconomicIndicator::getPeriodType, EconomicIndicator::setPeriodType),
            MergeField.of("frequency", EconomicIndicator::getFrequency, EconomicIndicator::setFrequency),
            MergeField.of("unit", EconomicIndicator::getUnit, EconomicIndicator::setUnit),
            MergeField.of("currency", EconomicIndicator::getCurrency, EconomicIndicator::setCurrency),
            MergeField.of("seasonalAdjustment", EconomicIndicator::getSeasonalAdjustment, EconomicIndicator::setSeasonalAdjustment),
            MergeField.of("preliminary", EconomicIndicator::getPreliminary, EconomicIndicator::setPreliminary),
            MergeField.of("importanceLevel", EconomicIndicator::getImportanceLevel, EconomicIndicator::setImportanceLevel),
            MergeField.of("marketImpact", EconomicIndicator::getMarketImpact, EconomicIndicator::setMarketImpact),
            MergeField.of("consensusEstimate", EconomicIndicator::getConsensusEstimate, EconomicIndicator::setConsensusEstimate),
            MergeField.of("surprise", EconomicIndicator::getSurprise, EconomicIndicator::setSurprise),
            MergeField.of("releaseDate", EconomicIndicator::getReleaseDate, EconomicIndicator::setReleaseDate),
            MergeField.of("nextReleaseDate", EconomicIndicator::getNextReleaseDate, EconomicIndicator::setNextReleaseDate),
            MergeField.of("sourceAgency", EconomicIndicator::getSourceAgency, EconomicIndicator::setSourceAgency),
            MergeField.of("status", EconomicIndicator::getStatus, EconomicIndicator::setStatus),
            MergeField.of("lastRevised", EconomicIndicator::getLastRevised, EconomicIndicator::setLastRevised),
            MergeField.of("revisionCount", EconomicIndicator::getRevisionCount, EconomicIndicator::setRevisionCount)
    );

    @Override
    public List<MergeField<EconomicIndicator, ?>> fields() {
        return FIELDS;
    }

    @Override
    public EconomicIndicator newRecord() {
        return new EconomicIndicator();
    }

    @Override
    public void applyDefaults(EconomicIndicator r) {
        if (MergeField.absent(r.getIndicatorName())) r.setIndicatorName(r.getIndicatorCode());
        if (MergeField.absent(r.getPeriodType())) r.setPeriodType("monthly");
        if (MergeField.absent(r.getFrequency())) r.setFrequency("monthly");
        if (MergeField.absent(r.getUnit())) r.setUnit("Index");
        if (MergeField.absent(r.getCurrency()) && "US".equalsIgnoreCase(r.getCountry())) r.setCurrency("USD");
        if (r.getSeasonalAdjustment() == null) r.setSeasonalAdjustment(Boolean.TRUE);
        if (r.getPreliminary() == null) r.setPreliminary(Boolean.FALSE);
        if (r.getImportanceLevel() == null) r.setImportanceLevel(1);
        if (MergeField.absent(r.getMarketImpact())) r.setMarketImpact("low");
        if (MergeField.absent(r.getStatus())) r.setStatus("final");
        if (r.getRevisionCount() == null) r.setRevisionCount(0);
    }

    @Override
    public void deriveRecordMetrics(EconomicIndicator r) {
        if (r.getSurprise() == null) r.setSurprise(DerivedMetrics.surprise(r.getValue(), r.getConsensusEstimate()));
    }

    /**
     * 직전 대비 변화: 레코드 자체의 previousValue 가 있으면 그것을, 없으면 같은 시리즈의 바로 이전(더 오래된) 레코드 값을 기준으로 쓴다.
     * 전년 대비 변화: 정확히 1년 전 기준일 레코드가 있을 때만 계산한다.
     */
    @Override
    public void deriveSeriesMetrics(List<EconomicIndicator> newestFirst) {
        for (int i = 0; i < newestFirst.size(); i++) {
            EconomicIndicator current = newestFirst.get(i);
            EconomicIndicator older = i + 1 < newestFirst.size() ? newestFirst.get(i + 1) : null;
            fillChange(current, older);
            fillYearOverYear(current, newestFirst);
        }
    }

    private static void fillChange(EconomicIndicator current, EconomicIndicator older) {
        if (current.getValue() == null) return;
        if (current.getChangeValue() != null && current.getChangePercent() != null) return;
        Double baseline = current.getPreviousValue();
        if (baseline == null && older != null) baseline = older.getValue();
        Double change = DerivedMetrics.change(current.getValue(), baseline);
        if (change == null) return;
        if (current.getPreviousValue() == null) current.setPreviousValue(baseline);
        if (current.getChangeValue() == null) current.setChangeValue(change);
        if (current.getChangePercent() == null) current.setChangePercent(DerivedMetrics.changePercent(current.getValue(), baseline));
    }

    private static void fillYearOverYear(EconomicIndicator current, List<EconomicIndicator> series) {
        if (current.getYearOverYearChange() != null || current.getValue() == null || current.getPeriodDate() == null) return;
        LocalDate yearAgo = current.getPeriodDate().minusYears(1);
        for (EconomicIndicator candidate : series) {
            if (yearAgo.equals(candidate.getPeriodDate())) {
                current.setYearOverYearChange(DerivedMetrics.changePercent(current.getValue(), candidate.getValue()));
                return;
            }
        }
    }

    @Override
    public List<String> conflictKey() {
        return List.of("indicatorCode", "country", "periodDate", "dataProvider");
    }

    @Override
    public String conflictId(EconomicIndicator r) {
        return String.join("|", r.getIndicatorCode(), r.getCountry(), String.valueOf(r.getPeriodDate()), r.getDataProvider());
    }
}
