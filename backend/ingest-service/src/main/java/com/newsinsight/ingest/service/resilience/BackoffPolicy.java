package com.newsinsight.ingest.service.resilience;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * 지수 백오프 + 지터.
 * attempt k(k >= 1) 이전 대기 시간 = base * 2^k + U[0,1) * jitterUnit
 */
public class BackoffPolicy {

    // 2^20 배 이상은 의미가 없으므로 상한
    private static final int MAX_EXPONENT = 20;

    private final Duration base;
    private final Duration jitterUnit;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration jitterUnit, DoubleSupplier random) {
        if (base.isNegative() || jitterUnit.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.base = base;
        this.jitterUnit = jitterUnit;
        this.random = random;
    }

    public Duration delayBeforeAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
        return minimumDelay(attempt).plusNanos((long) (random.getAsDouble() * jitterUnit.toNanos()));
    }

    /**
     * Lower bound of {@link #delayBeforeAttempt(int)}: base * 2^k.
     */
    public Duration minimumDelay(int attempt) {
        return base.multipliedBy(1L << Math.min(attempt, MAX_EXPONENT));
    }

    /**
     * resilience4j Retry passes the number of attempts made so far, i.e. 1 before the second call.
     */
    public IntervalFunction asIntervalFunction() {
        return attempts -> delayBeforeAttempt(attempts).toMillis();
    }

    public Duration getBase() {
        return base;
    }

    public Duration getJitterUnit() {
        return jitterUnit;
    }
}
