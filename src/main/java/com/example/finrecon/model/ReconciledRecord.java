package com.example.finrecon.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 여러 제공자 데이터를 병합한 정규 레코드의 공통 부분.
 * 출처(provenance)는 삽입 순서를 유지하는 중복 없는 집합이다.
 */
@Getter
@Setter
public abstract class ReconciledRecord {

    @Id
    @JsonIgnore
    private String id;              // conflict key, assigned by the sink

    @Schema(description = "기여한 제공자 코드 목록(순서 유지)", example = "[\"fmp\", \"fred\"]")
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> providers = new LinkedHashSet<>();

    @Schema(description = "출처 문자열(쉼표 결합)", example = "fmp, fred")
    private String dataProvider;

    /** Natural key, or {@code null} when a required key field is missing. */
    public abstract String naturalKey();

    /** Natural key without the period component. */
    public abstract String seriesKey();

    /** Date used for newest-first ordering. */
    public abstract LocalDate periodDate();

    public void addProvider(String code) {
        if (code != null && !code.isBlank()) providers.add(code.trim());
    }

    public void addProviders(Set<String> codes) {
        if (codes == null) return;
        for (String c : codes) addProvider(c);
    }

    /** Renders provenance into {@link #getDataProvider()}. */
    public void renderProvenance() {
        this.dataProvider = String.join(", ", providers);
    }
}
