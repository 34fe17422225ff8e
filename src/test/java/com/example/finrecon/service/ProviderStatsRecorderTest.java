package com.example.finrecon.service;

import com.example.finrecon.model.ProviderId;
import com.example.finrecon.model.ProviderOutcome;
import com.example.finrecon.model.doc.ProviderStats;
import com.example.finrecon.repo.ProviderStatsRepository;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderStatsRecorderTest {

    private static final Instant NOW = Instant.parse("2024-05-15T00:00:00Z");

    @Mock
    ProviderStatsRepository repository;

    @Test
    void averageCoversSuccessfulAttemptsOnly() {
        ProviderStats s = ProviderStatsRecorder.fresh("fred");
        ProviderStatsRecorder.apply(s, ProviderOutcome.success(ProviderId.FRED, 3, 100), NOW);
        ProviderStatsRecorder.apply(s, ProviderOutcome.timeout(ProviderId.FRED, 60_000), NOW);
        ProviderStatsRecorder.apply(s, ProviderOutcome.failed(ProviderId.FRED, 5, "no data"), NOW);
        ProviderStatsRecorder.apply(s, ProviderOutcome.success(ProviderId.FRED, 2, 300), NOW);

        assertEquals(4, s.getTotalAttempts());
        assertEquals(2, s.getSuccessfulAttempts());
        assertEquals(2, s.getFailedAttempts());
        assertEquals(200.0, s.getAvgResponseTimeMs());
        assertEquals(0, s.getConsecutiveFailures());
        assertEquals(NOW, s.getLastSuccess());
        assertEquals(NOW, s.getLastFailure());
    }

    @Test
    void consecutiveFailuresAccumulate() {
        ProviderStats s = ProviderStatsRecorder.fresh("fmp");
        ProviderStatsRecorder.apply(s, ProviderOutcome.failed(ProviderId.FMP, 5, "x"), NOW);
        ProviderStatsRecorder.apply(s, ProviderOutcome.failed(ProviderId.FMP, 5, "x"), NOW);

        assertEquals(2, s.getConsecutiveFailures());
        assertNull(s.getLastSuccess());
    }

    @Test
    void recordCreatesMissingStats() {
        when(repository.findById(anyString())).thenReturn(Mono.empty());
        when(repository.save(any(ProviderStats.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        ProviderStatsRecorder recorder = new ProviderStatsRecorder(repository, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(recorder.record(List.of(
                        ProviderOutcome.success(ProviderId.FMP, 1, 40),
                        ProviderOutcome.failed(ProviderId.FRED, 10, "no data"))))
                .verifyComplete();

        ArgumentCaptor<ProviderStats> saved = ArgumentCaptor.forClass(ProviderStats.class);
        verify(repository, times(2)).save(saved.capture());
        assertEquals("fmp", saved.getAllValues().get(0).getId());
        assertEquals(40.0, saved.getAllValues().get(0).getAvgResponseTimeMs());
        assertEquals("fred", saved.getAllValues().get(1).getId());
        assertEquals(1, saved.getAllValues().get(1).getFailedAttempts());
    }

    @Test
    void concurrentUpdateIsReappliedOnFreshRead() {
        // another run saved fmp between our read and write: the increment must land on its totals
        when(repository.findById("fmp"))
                .thenAnswer(inv -> Mono.just(stored(10, 1L)))
                .thenAnswer(inv -> Mono.just(stored(11, 2L)));
        when(repository.save(any(ProviderStats.class)))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("version 1 is stale")))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        ProviderStatsRecorder recorder = new ProviderStatsRecorder(repository, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(recorder.record(List.of(ProviderOutcome.success(ProviderId.FMP, 1, 40))))
                .verifyComplete();

        ArgumentCaptor<ProviderStats> saved = ArgumentCaptor.forClass(ProviderStats.class);
        verify(repository, times(2)).findById("fmp");
        verify(repository, times(2)).save(saved.capture());
        ProviderStats last = saved.getAllValues().get(1);
        assertEquals(12, last.getTotalAttempts());
        assertEquals(2L, last.getVersion());
    }

    @Test
    void persistentConflictGivesUpWithoutFailingTheRun() {
        when(repository.findById("fmp")).thenAnswer(inv -> Mono.just(stored(10, 1L)));
        when(repository.save(any(ProviderStats.class)))
                .thenAnswer(inv -> Mono.error(new OptimisticLockingFailureException("stale")));
        ProviderStatsRecorder recorder = new ProviderStatsRecorder(repository, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(recorder.record(List.of(ProviderOutcome.success(ProviderId.FMP, 1, 40))))
                .verifyComplete();

        verify(repository, times(ProviderStatsRecorder.MAX_CONFLICT_RETRIES + 1)).save(any(ProviderStats.class));
    }

    private static ProviderStats stored(long totalAttempts, Long version) {
        ProviderStats s = ProviderStatsRecorder.fresh("fmp");
        s.setTotalAttempts(totalAttempts);
        s.setVersion(version);
        return s;
    }

    @Test
    void repositoryErrorIsSwallowed() {
        when(repository.findById(anyString())).thenReturn(Mono.error(new IllegalStateException("mongo down")));
        ProviderStatsRecorder recorder = new ProviderStatsRecorder(repository, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(recorder.record(List.of(ProviderOutcome.success(ProviderId.FMP, 1, 40))))
                .verifyComplete();
    }
}
