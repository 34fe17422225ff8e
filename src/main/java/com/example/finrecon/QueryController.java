package com.example.finrecon;

import com.example.finrecon.exception.NotFoundException;
import com.example.finrecon.model.EarningsReport;
import com.example.finrecon.model.EconomicIndicator;
import com.example.finrecon.model.doc.ProviderStats;
import com.example.finrecon.service.RecordQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Query API", description = "저장된 병합 레코드/제공자 통계 조회")
@RequiredArgsConstructor
public class QueryController {

    private final RecordQueryService queryService;

    @GetMapping("/indicators")
    @Operation(summary = "경제 지표 조회", description = "기준일 내림차순. code 미지정 시 국가 전체")
    public Mono<List<EconomicIndicator>> indicators(
            @Parameter(description = "표준 지표 코드 예) GDP, CPI, UNEMPLOYMENT") @RequestParam(required = false) String code,
            @Parameter(description = "국가 코드") @RequestParam(defaultValue = "US") String country) {
        String c = code == null || code.isBlank() ? null : code.trim().toUpperCase();
        String ctry = country.trim().toUpperCase();
        return queryService.indicators(c, ctry)
                .flatMap(list -> list.isEmpty()
                        ? Mono.error(new NotFoundException("No indicators for " + (c == null ? "" : c + "/") + ctry))
                        : Mono.just(list));
    }

    @GetMapping("/earnings")
    @Operation(summary = "실적 조회", description = "보고일 내림차순")
    public Mono<List<EarningsReport>> earnings(
            @Parameter(description = "티커. 예) AAPL") @RequestParam String symbol) {
        String s = symbol.trim().toUpperCase();
        return queryService.earnings(s)
                .flatMap(list -> list.isEmpty()
                        ? Mono.error(new NotFoundException("No earnings for " + s))
                        : Mono.just(list));
    }

    @GetMapping("/providers/stats")
    @Operation(summary = "제공자 통계", description = "시도/성공/실패 횟수, 평균 응답 시간, 연속 실패 횟수")
    public Mono<List<ProviderStats>> providerStats() {
        return queryService.providerStats();
    }
}
