package com.example.finrecon.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

@Getter
@Setter
@Document(collection = "earnings_data")
@CompoundIndex(name = "symbol_period", def = "{'symbol': 1, 'fiscalYear': -1, 'fiscalQuarter': -1}")
@Schema(description = "실적 데이터(여러 제공자 병합 결과)")
public class EarningsReport extends ReconciledRecord {

    public static final String ANNUAL = "annual";

    @Schema(description = "티커", example = "AAPL")
    private String symbol;

    @Schema(description = "회계연도", example = "2024")
    private Integer fiscalYear;

    @Schema(description = "회계분기(연간 보고서는 null)", example = "2")
    private Integer fiscalQuarter;

    @Schema(description = "보고일", example = "2024-06-30")
    private LocalDate reportedDate;

    @Schema(description = "보고 유형 quarterly/annual", example = "quarterly")
    private String reportType;

    // EPS
    @Schema(description = "EPS 실적")
    private Double eps;
    @Schema(description = "EPS 예상치")
    private Double epsEstimated;
    @Schema(description = "EPS 서프라이즈")
    private Double epsSurprise;
    @Schema(description = "EPS 서프라이즈(%)")
    private Double epsSurprisePercent;

    // 매출
    @Schema(description = "매출")
    private Double revenue;
    @Schema(description = "매출 예상치")
    private Double revenueEstimated;
    @Schema(description = "매출 서프라이즈")
    private Double revenueSurprise;
    @Schema(description = "매출 서프라이즈(%)")
    private Double revenueSurprisePercent;

    // 손익계산서
    @Schema(description = "순이익")
    private Double netIncome;
    @Schema(description = "매출총이익")
    private Double grossProfit;
    @Schema(description = "영업이익")
    private Double operatingIncome;
    @Schema(description = "EBITDA")
    private Double ebitda;

    @Schema(description = "영업이익률(소수)", example = "0.2981")
    private Double operatingMargin;
    @Schema(description = "순이익률(소수)", example = "0.2435")
    private Double netMargin;
    @Schema(description = "전년 동기 대비 EPS 성장률(%)")
    private Double yearOverYearEpsGrowth;
    @Schema(description = "전년 동기 대비 매출 성장률(%)")
    private Double yearOverYearRevenueGrowth;

    // 가이던스
    @Schema(description = "경영진 가이던스")
    private String guidance;
    @Schema(description = "차기 연도 EPS 가이던스")
    private Double nextYearEpsGuidance;
    @Schema(description = "차기 연도 매출 가이던스")
    private Double nextYearRevenueGuidance;

    // 컨퍼런스 콜
    @Schema(description = "컨퍼런스 콜 일자")
    private LocalDate conferenceCallDate;
    @Schema(description = "녹취록 URL")
    private String transcriptUrl;
    @Schema(description = "오디오 URL")
    private String audioUrl;

    @Schema(description = "EPS beat/miss/met", example = "beat")
    private String epsBeatMissMet;
    @Schema(description = "매출 beat/miss/met", example = "miss")
    private String revenueBeatMissMet;

    /** Quarter number as text, or {@code "annual"} for full-year reports. */
    public String periodMarker() {
        return fiscalQuarter == null ? ANNUAL : String.valueOf(fiscalQuarter);
    }

    @Override
    public String naturalKey() {
        if (symbol == null || symbol.isBlank() || fiscalYear == null || reportedDate == null) return null;
        return symbol + "-" + fiscalYear + "-" + periodMarker();
    }

    @Override
    public String seriesKey() {
        return symbol;
    }

    @Override
    public LocalDate periodDate() {
        return reportedDate;
    }
}
