package com.example.finrecon.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "수집 실행 요약")
public class IngestSummary {

    @Schema(description = "저장 성공 여부")
    private boolean success;

    @Schema(description = "요약 메시지")
    private String message;

    @Schema(description = "조회 기간(기간 기반 수집에서만)")
    private DateRange dateRange;

    @Schema(description = "집계 카운트")
    private Counts summary = new Counts();

    @Schema(description = "제공자별 결과(단일 디스패치 수집에서만)")
    private List<ProviderOutcome> providers;

    @Schema(description = "엔티티별 결과(상한 적용)")
    private List<EntityOutcome> results;

    @Getter
    @Setter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Counts {
        @Schema(description = "데이터를 반환한 제공자 수")
        private Integer successfulProviders;

        @Schema(description = "대상 엔티티 수")
        private Integer totalEntities;

        @Schema(description = "처리한 엔티티 수")
        private Integer processed;

        @Schema(description = "성공한 엔티티 수")
        private Integer successful;

        @Schema(description = "저장된 병합 레코드 수")
        private int totalRecords;

        @Schema(description = "오류 수")
        private int errors;
    }

    public void addResult(EntityOutcome outcome, int limit) {
        if (results == null) results = new ArrayList<>();
        if (results.size() < limit) results.add(outcome);
    }
}
