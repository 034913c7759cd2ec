package com.newsinsight.ingest.service.resilience;

import com.newsinsight.ingest.exception.FetchException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 소스별 호출 상태 (프로세스 수명 동안만 유지).
 *
 * 회로 상태 자체는 resilience4j 상태 머신이 소유하고, 여기서는 연속 실패 수,
 * 마지막 오류, 회로가 열린 시각을 원자적으로 기록해 상태 조회에 제공한다.
 */
@Component
@Slf4j
public class SourceHealthRegistry {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;
    private final Map<String, SourceHealth> health = new ConcurrentHashMap<>();

    public SourceHealthRegistry(CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.clock = clock;
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::attach);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> attach(event.getAddedEntry()));
    }

    private void attach(CircuitBreaker breaker) {
        breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State to = event.getStateTransition().getToState();
            SourceHealth sourceHealth = of(breaker.getName());
            if (to == CircuitBreaker.State.OPEN) {
                sourceHealth.openedAt.set(clock.instant());
                log.warn("Circuit opened for source {} ({})", breaker.getName(), event.getStateTransition());
            } else if (to == CircuitBreaker.State.CLOSED) {
                sourceHealth.openedAt.set(null);
                log.info("Circuit closed for source {}", breaker.getName());
            } else {
                log.info("Circuit for source {} moved {}", breaker.getName(), event.getStateTransition());
            }
        });
    }

    public void recordSuccess(String sourceId) {
        SourceHealth sourceHealth = of(sourceId);
        sourceHealth.consecutiveFailures.set(0);
        sourceHealth.successes.incrementAndGet();
    }

    /**
     * One failed adapter attempt.
     */
    public void recordAttemptFailure(String sourceId) {
        of(sourceId).consecutiveFailures.incrementAndGet();
    }

    /**
     * Final failure of a wrapped call, after retries.
     */
    public void recordOutcomeFailure(String sourceId, FetchException error) {
        SourceHealth sourceHealth = of(sourceId);
        sourceHealth.lastError.set(new LastError(error.getType(), error.getMessage(), clock.instant()));
        sourceHealth.failuresByType.computeIfAbsent(error.getType(), t -> new AtomicLong()).incrementAndGet();
    }

    public CircuitBreaker.State circuitState(String sourceId) {
        return circuitBreakerRegistry.find(sourceId)
                .map(CircuitBreaker::getState)
                .orElse(CircuitBreaker.State.CLOSED);
    }

    public Optional<SourceHealthSnapshot> snapshot(String sourceId) {
        SourceHealth sourceHealth = health.get(sourceId);
        return Optional.ofNullable(sourceHealth).map(h -> h.snapshot(sourceId, circuitState(sourceId)));
    }

    /**
     * Snapshots of every source seen so far, sorted by source id.
     */
    public Map<String, SourceHealthSnapshot> snapshots() {
        Map<String, SourceHealthSnapshot> result = new TreeMap<>();
        health.forEach((sourceId, h) -> result.put(sourceId, h.snapshot(sourceId, circuitState(sourceId))));
        return result;
    }

    private SourceHealth of(String sourceId) {
        return health.computeIfAbsent(sourceId, id -> new SourceHealth());
    }

    public record LastError(FetchException.Type type, String message, Instant at) {
    }

    public record SourceHealthSnapshot(
            String sourceId,
            CircuitBreaker.State circuitState,
            int consecutiveFailures,
            Instant openedAt,
            long successes,
            Map<FetchException.Type, Long> failuresByType,
            LastError lastError
    ) {
    }

    private static final class SourceHealth {
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicReference<Instant> openedAt = new AtomicReference<>();
        private final AtomicReference<LastError> lastError = new AtomicReference<>();
        private final Map<FetchException.Type, AtomicLong> failuresByType = new ConcurrentHashMap<>();

        SourceHealthSnapshot snapshot(String sourceId, CircuitBreaker.State state) {
            Map<FetchException.Type, Long> failures = new TreeMap<>();
            failuresByType.forEach((type, count) -> failures.put(type, count.get()));
            return new SourceHealthSnapshot(sourceId, state, consecutiveFailures.get(), openedAt.get(),
                    successes.get(), failures, lastError.get());
        }
    }
}
