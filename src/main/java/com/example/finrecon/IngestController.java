package com.example.finrecon;

import com.example.finrecon.model.IngestSummary;
import com.example.finrecon.service.EarningsIngestService;
import com.example.finrecon.service.IndicatorIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Ingest API", description = "다중 제공자 수집 → 병합 → 저장 실행")
@RequiredArgsConstructor
public class IngestController {

    private final IndicatorIngestService indicatorIngest;
    private final EarningsIngestService earningsIngest;

    @PostMapping("/ingest/economic-indicators")
    @Operation(summary = "경제 지표 수집", description = "오늘 기준 앞뒤 기간(기본 ±15일)의 지표를 모든 제공자에서 받아 병합 후 저장. 저장된 레코드가 없으면 404")
    public Mono<ResponseEntity<IngestSummary>> indicators(
            @Parameter(description = "국가 코드(미지정 시 설정값, 기본 US)") @RequestParam(required = false) String country) {
        return indicatorIngest.run(country)
                .map(s -> ResponseEntity.status(s.isSuccess() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(s));
    }

    @PostMapping("/ingest/earnings")
    @Operation(summary = "실적 수집", description = "심볼별로 모든 실적 제공자 데이터를 병합 후 저장. 배치(기본 5개) 단위 순차 처리. 처리할 심볼이 없으면 404")
    public Mono<ResponseEntity<IngestSummary>> earnings(
            @Parameter(description = "쉼표 구분 심볼 목록(미지정 시 ingest.earnings.symbols)") @RequestParam(required = false) List<String> symbols) {
        return earningsIngest.run(symbols)
                .map(s -> ResponseEntity.status(s.isSuccess() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(s));
    }
}
