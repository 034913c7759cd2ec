package com.newsinsight.ingest.service.resilience;

import com.newsinsight.ingest.exception.FetchException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * 외부 어댑터 호출 보호기.
 *
 * 시도마다 소스의 회로 차단기와 데드라인을 통과하고, 실패하면 백오프 후 재시도한다.
 * 예외를 던지지 않고 {@link FetchOutcome}으로 결과를 돌려준다.
 */
@Component
@Slf4j
public class ResilientFetchExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final TimeLimiter timeLimiter;
    private final SourceHealthRegistry healthRegistry;
    private final Executor fetchCallExecutor;
    private final MeterRegistry meterRegistry;

    public ResilientFetchExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                                  RetryRegistry retryRegistry,
                                  TimeLimiter timeLimiter,
                                  SourceHealthRegistry healthRegistry,
                                  @Qualifier("fetchCallExecutor") Executor fetchCallExecutor,
                                  MeterRegistry meterRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.timeLimiter = timeLimiter;
        this.healthRegistry = healthRegistry;
        this.fetchCallExecutor = fetchCallExecutor;
        this.meterRegistry = meterRegistry;
    }

    public <T> FetchOutcome<T> call(String sourceId, Callable<T> adapterCall) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(sourceId);
        Retry retry = retryRegistry.retry(sourceId);

        Callable<T> deadlined = () -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(() -> invoke(adapterCall), fetchCallExecutor));
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, () -> {
            try {
                return deadlined.call();
            } catch (Exception e) {
                healthRegistry.recordAttemptFailure(sourceId);
                log.debug("Attempt for source {} failed: {}", sourceId, describe(e));
                throw e;
            }
        });
        Callable<T> protectedCall = Retry.decorateCallable(retry, guarded);

        try {
            T value = protectedCall.call();
            healthRegistry.recordSuccess(sourceId);
            return FetchOutcome.success(value);
        } catch (Exception e) {
            FetchException error = classify(sourceId, e, retry.getRetryConfig().getMaxAttempts());
            healthRegistry.recordOutcomeFailure(sourceId, error);
            meterRegistry.counter("ingest.fetch.failures",
                    "source", sourceId, "type", error.getType().name()).increment();
            if (error.getType() == FetchException.Type.CIRCUIT_OPEN) {
                log.debug("Source {} short-circuited", sourceId);
            } else {
                log.warn("Fetch from source {} failed with {}: {}", sourceId, error.getType(), error.getMessage());
            }
            return FetchOutcome.failure(error);
        }
    }

    /**
     * Per-attempt deadline, handed to adapters so they can bound their own I/O.
     */
    public Duration callTimeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }

    private FetchException classify(String sourceId, Exception e, int maxAttempts) {
        if (e instanceof CallNotPermittedException) {
            return new FetchException(FetchException.Type.CIRCUIT_OPEN, sourceId,
                    "Circuit open for source " + sourceId, e);
        }
        if (e instanceof FetchException fe && fe.getType() == FetchException.Type.INVALID_RESPONSE) {
            return fe;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (e instanceof TimeoutException && maxAttempts <= 1) {
            return new FetchException(FetchException.Type.TIMEOUT, sourceId,
                    "Call to source " + sourceId + " exceeded " + callTimeout(), e);
        }
        return new FetchException(FetchException.Type.EXHAUSTED, sourceId,
                "Retry budget of " + maxAttempts + " attempts exhausted for source " + sourceId
                        + " (last error: " + describe(e) + ")", e);
    }

    private static <T> T invoke(Callable<T> adapterCall) {
        try {
            return adapterCall.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private static String describe(Throwable t) {
        if (t instanceof TimeoutException) {
            return "timeout";
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
