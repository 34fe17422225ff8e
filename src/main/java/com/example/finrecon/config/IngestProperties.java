package com.example.finrecon.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {

    /** 어댑터 1회 호출 상한. 초과 시 해당 제공자만 실패 처리 */
    private Duration adapterTimeout = Duration.ofSeconds(60);

    private int batchSize = 5;
    private Duration batchDelay = Duration.ofMillis(3000);
    private Duration entityDelay = Duration.ofMillis(500);

    /** 요약 응답에 포함할 엔티티별 결과 상한 */
    private int resultsLimit = 50;

    private Indicators indicators = new Indicators();
    private Earnings earnings = new Earnings();
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Indicators {
        private String country = "US";
        private int lookbackDays = 15;
        private int lookaheadDays = 15;
        private int maxPoints = 10;
    }

    @Getter
    @Setter
    public static class Earnings {
        private int limit = 8;
        private List<String> symbols = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Schedule {
        private String indicatorsCron = "-";
        private String earningsCron = "-";
    }
}
