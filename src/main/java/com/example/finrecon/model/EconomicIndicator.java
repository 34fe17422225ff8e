package com.example.finrecon.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

@Getter
@Setter
@Document(collection = "economic_indicators")
@CompoundIndex(name = "code_country_period", def = "{'indicatorCode': 1, 'country': 1, 'periodDate': -1}")
@Schema(description = "경제 지표(여러 제공자 병합 결과)")
public class EconomicIndicator extends ReconciledRecord {

    @Schema(description = "표준 지표 코드", example = "GDP")
    private String indicatorCode;

    @Schema(description = "지표 이름", example = "Gross Domestic Product")
    private String indicatorName;

    @Schema(description = "국가 코드", example = "US")
    private String country;

    @Schema(description = "지표 값")
    private Double value;

    @Schema(description = "직전 기간 값")
    private Double previousValue;

    @Schema(description = "직전 대비 절대 변화")
    private Double changeValue;

    @Schema(description = "직전 대비 변화율(%)", example = "5.26")
    private Double changePercent;

    @Schema(description = "전년 동기 대비 변화율(%)")
    private Double yearOverYearChange;

    @Schema(description = "지표 기준일", example = "2024-01-01")
    private LocalDate periodDate;

    @Schema(description = "기간 유형", example = "quarterly")
    private String periodType;

    @Schema(description = "발표 주기", example = "quarterly")
    private String frequency;

    @Schema(description = "단위", example = "B")
    private String unit;

    @Schema(description = "통화", example = "USD")
    private String currency;

    @Schema(description = "계절 조정 여부")
    private Boolean seasonalAdjustment;

    @Schema(description = "잠정치 여부")
    private Boolean preliminary;

    @Schema(description = "중요도 1=낮음, 2=보통, 3=높음", example = "3")
    private Integer importanceLevel;

    @Schema(description = "시장 영향도", example = "high")
    private String marketImpact;

    @Schema(description = "시장 컨센서스")
    private Double consensusEstimate;

    @Schema(description = "컨센서스 대비 서프라이즈")
    private Double surprise;

    @Schema(description = "공식 발표일")
    private LocalDate releaseDate;

    @Schema(description = "다음 발표 예정일")
    private LocalDate nextReleaseDate;

    @Schema(description = "발표 기관", example = "BEA")
    private String sourceAgency;

    @Schema(description = "상태 preliminary/revised/final", example = "final")
    private String status;

    @Schema(description = "최종 수정일")
    private LocalDate lastRevised;

    @Schema(description = "수정 횟수", example = "0")
    private Integer revisionCount;

    @Override
    public String naturalKey() {
        if (isBlank(indicatorCode) || isBlank(country) || periodDate == null) return null;
        return indicatorCode + "-" + country + "-" + periodDate;
    }

    @Override
    public String seriesKey() {
        return indicatorCode + "-" + country;
    }

    @Override
    public LocalDate periodDate() {
        return periodDate;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
