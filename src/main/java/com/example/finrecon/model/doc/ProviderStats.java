package com.example.finrecon.model.doc;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Getter
@Setter
@Document(collection = "provider_stats")
@Schema(description = "제공자 호출 통계")
public class ProviderStats {
    @Id
    private String id;                 // provider code
    private long totalAttempts;
    private long successfulAttempts;
    private long failedAttempts;
    private double avgResponseTimeMs;  // running mean over successful attempts
    private int consecutiveFailures;
    private Instant lastSuccess;
    private Instant lastFailure;
    private Instant updatedAt;
    @Version
    @Schema(hidden = true)
    private Long version;
}
