package com.newsinsight.ingest.config;

import com.newsinsight.ingest.exception.FetchException;
import com.newsinsight.ingest.service.resilience.BackoffPolicy;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 소스별 회로 차단기, 재시도, 호출 데드라인 설정.
 */
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    private final IngestProperties properties;

    @Bean
    public BackoffPolicy backoffPolicy() {
        IngestProperties.Resilience config = properties.getResilience();
        return new BackoffPolicy(config.getBaseDelay(), config.getJitterUnit(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * N회 연속 실패 시 열림: 크기 N의 카운트 윈도우가 전부 실패일 때만 실패율 100%에 도달한다.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(circuitBreakerConfig(properties.getResilience()));
    }

    @Bean
    public RetryRegistry retryRegistry(BackoffPolicy backoffPolicy) {
        return RetryRegistry.of(retryConfig(properties.getResilience(), backoffPolicy));
    }

    @Bean
    public TimeLimiter fetchTimeLimiter() {
        return TimeLimiter.of("fetch", TimeLimiterConfig.custom()
                .timeoutDuration(properties.getResilience().getCallTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    public static CircuitBreakerConfig circuitBreakerConfig(IngestProperties.Resilience config) {
        int threshold = Math.max(1, config.getFailureThreshold());
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(config.getCoolDown())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }

    public static RetryConfig retryConfig(IngestProperties.Resilience config, BackoffPolicy backoffPolicy) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxAttempts()))
                .intervalFunction(backoffPolicy.asIntervalFunction())
                .retryOnException(ResilienceConfig::isRetryable)
                .build();
    }

    /**
     * Open circuits and unparseable responses are final for this call.
     */
    static boolean isRetryable(Throwable t) {
        if (t instanceof CallNotPermittedException) {
            return false;
        }
        return !(t instanceof FetchException fe && fe.getType() == FetchException.Type.INVALID_RESPONSE);
    }
}
