package com.example.finrecon.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "제공자별 수집 결과")
public class ProviderOutcome {

    public enum Status { SUCCESS, FAILED, TIMEOUT }

    @Schema(description = "제공자 코드", example = "fred")
    ProviderId provider;

    @Schema(description = "결과 상태")
    Status status;

    @Schema(description = "반환된 부분 레코드 수")
    int records;

    @Schema(description = "소요 시간(ms)")
    long elapsedMs;

    @Schema(description = "실패 사유")
    String message;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static ProviderOutcome success(ProviderId provider, int records, long elapsedMs) {
        return new ProviderOutcome(provider, Status.SUCCESS, records, elapsedMs, null);
    }

    public static ProviderOutcome failed(ProviderId provider, long elapsedMs, String message) {
        return new ProviderOutcome(provider, Status.FAILED, 0, elapsedMs, message);
    }

    public static ProviderOutcome timeout(ProviderId provider, long elapsedMs) {
        return new ProviderOutcome(provider, Status.TIMEOUT, 0, elapsedMs, "timed out");
    }
}
