package com.example.finrecon.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "엔티티(심볼/지표 세트) 단위 처리 결과")
public class EntityOutcome {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @Schema(description = "대상 엔티티", example = "AAPL")
    String entity;

    @Schema(description = "success 또는 error")
    String status;

    @Schema(description = "오류 메시지")
    String message;

    @Schema(description = "저장된 병합 레코드 수")
    Integer records;

    @Schema(description = "데이터를 반환한 제공자 수")
    Integer providers;

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public static EntityOutcome success(String entity, int records, int providers) {
        return new EntityOutcome(entity, SUCCESS, null, records, providers);
    }

    public static EntityOutcome error(String entity, String message) {
        return new EntityOutcome(entity, ERROR, message, null, null);
    }
}
