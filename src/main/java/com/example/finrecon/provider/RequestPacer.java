package com.example.finrecon.provider;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * 순차 호출 사이에 고정 간격(politeness delay)을 둔다.
 * 타이머 스케줄러를 주입받으므로 테스트에서는 가상 시간으로 대체할 수 있다.
 */
public class RequestPacer {

    private final Duration gap;
    private final Scheduler timer;

    public RequestPacer(Duration gap, Scheduler timer) {
        this.gap = gap == null || gap.isNegative() ? Duration.ZERO : gap;
        this.timer = timer;
    }

    public static RequestPacer fixed(Duration gap) {
        return new RequestPacer(gap, Schedulers.parallel());
    }

    public static RequestPacer none() {
        return new RequestPacer(Duration.ZERO, Schedulers.immediate());
    }

    public Duration gap() {
        return gap;
    }

    /** Waits for the configured gap (completes immediately when the gap is zero). */
    public Mono<Void> pause() {
        if (gap.isZero()) return Mono.empty();
        return Mono.delay(gap, timer).then();
    }

    /**
     * Runs {@code call} for each item strictly one after another, pausing between consecutive calls.
     * Each call's own failures must already be handled by the caller.
     */
    public <S, T> Flux<T> sequence(List<S> items, Function<S, Mono<T>> call) {
        return Flux.range(0, items.size())
                .concatMap(i -> i == 0
                        ? Mono.defer(() -> call.apply(items.get(i)))
                        : pause().then(Mono.defer(() -> call.apply(items.get(i)))));
    }
}
