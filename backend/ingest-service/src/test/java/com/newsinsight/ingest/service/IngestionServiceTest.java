package com.newsinsight.ingest.service;

import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.client.StubFetcher;
import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.config.ResilienceConfig;
import com.newsinsight.ingest.dto.IngestionResult;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.exception.FetchException;
import com.newsinsight.ingest.exception.StoreException;
import com.newsinsight.ingest.service.resilience.BackoffPolicy;
import com.newsinsight.ingest.service.resilience.ResilientFetchExecutor;
import com.newsinsight.ingest.service.resilience.SourceHealthRegistry;
import com.newsinsight.ingest.store.InMemoryArticleStore;
import com.newsinsight.ingest.store.UpsertResult;
import com.newsinsight.ingest.util.KeywordExtractor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * IngestionService 테스트. 실제 정규화기, 중복 제거기, 메모리 저장소로 파이프라인 전체를 돈다.
 */
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ExecutorService pool;
    private InMemoryArticleStore store;
    private SimpleMeterRegistry meterRegistry;
    private StubFetcher gnews;
    private StubFetcher rss;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryArticleStore(clock);
        meterRegistry = new SimpleMeterRegistry();
        gnews = new StubFetcher("gnews");
        rss = new StubFetcher("rss");

        IngestProperties properties = new IngestProperties();
        properties.getResilience().setMaxAttempts(1);
        IngestProperties.Resilience resilience = properties.getResilience();
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(1), Duration.ZERO, () -> 0.0);
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(ResilienceConfig.circuitBreakerConfig(resilience));
        ResilientFetchExecutor fetchExecutor = new ResilientFetchExecutor(
                breakers,
                RetryRegistry.of(ResilienceConfig.retryConfig(resilience, backoff)),
                TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofSeconds(5)).build()),
                new SourceHealthRegistry(breakers, clock),
                pool,
                meterRegistry);

        ingestionService = new IngestionService(
                new FetcherRegistry(List.of(gnews, rss)),
                fetchExecutor,
                new ArticleNormalizer(new KeywordExtractor(properties), properties, meterRegistry, clock),
                new ArticleDeduplicationService(store, properties, meterRegistry, clock),
                meterRegistry,
                pool,
                clock);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("수집, 정규화, 저장 결과를 집계한다")
    void countsPipelineOutcome() {
        // given
        gnews.returning(Map.of("link", "https://a.com/1", "title", "Gold hits record high"))
                .returning(Map.of("link", "https://a.com/2", "title", "Gold hits record high again"))
                .returning(Map.of("title", "No link"))
                .returning(Map.of("link", "https://a.com/3", "title", "Copper demand slows in China"));

        // when
        IngestionResult result = ingestionService.ingest("metals", "gnews");

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.fetched()).isEqualTo(4);
        assertThat(result.dropped()).isEqualTo(1);
        assertThat(result.inserted()).isEqualTo(2);
        assertThat(result.suppressed()).isEqualTo(1);
        assertThat(gnews.queries()).containsExactly("metals");
        assertThat(store.all()).extracting(Article::getUrl).containsExactly("https://a.com/1", "https://a.com/3");
    }

    @Test
    @DisplayName("두 번째 실행은 같은 URL을 갱신한다")
    void rerunUpdatesExistingUrls() {
        gnews.returning(Map.of("link", "https://a.com/1", "title", "Gold hits record high"));

        ingestionService.ingest("metals", "gnews");
        IngestionResult second = ingestionService.ingest("metals", "gnews");

        assertThat(second.inserted()).isZero();
        assertThat(second.updated()).isEqualTo(1);
        assertThat(store.all()).hasSize(1);
    }

    @Test
    @DisplayName("어댑터 실패는 결과에 기록되고 저장소는 변하지 않는다")
    void fetchFailureIsReported() {
        gnews.failingWith(FetchException.invalidResponse("gnews", "not xml", null));

        IngestionResult result = ingestionService.ingest("metals", "gnews");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.fetchError()).isEqualTo(FetchException.Type.INVALID_RESPONSE);
        assertThat(store.all()).isEmpty();
        assertThat(ingestionService.lastRuns()).containsKey("metals|gnews");
    }

    @Test
    @DisplayName("알 수 없는 소스는 실패 결과")
    void unknownSource() {
        IngestionResult result = ingestionService.ingest("metals", "twitter");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorMessage()).contains("twitter");
    }

    @Test
    @DisplayName("저장 실패는 해당 기사만 건너뛴다")
    void storeFailureSkipsOnlyThatArticle() {
        InMemoryArticleStore failing = new InMemoryArticleStore(Clock.fixed(NOW, ZoneOffset.UTC)) {
            @Override
            public synchronized UpsertResult upsertByUrl(Article article) {
                if (article.getUrl().endsWith("/bad")) {
                    throw new StoreException(StoreException.Kind.UNAVAILABLE, "connection refused", null);
                }
                return super.upsertByUrl(article);
            }
        };
        IngestProperties properties = new IngestProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
        IngestionService service = new IngestionService(
                new FetcherRegistry(List.of(gnews)),
                new ResilientFetchExecutor(breakers, RetryRegistry.ofDefaults(),
                        TimeLimiter.of(Duration.ofSeconds(5)), new SourceHealthRegistry(breakers, clock),
                        pool, meterRegistry),
                new ArticleNormalizer(new KeywordExtractor(properties), properties, meterRegistry, clock),
                new ArticleDeduplicationService(failing, properties, meterRegistry, clock),
                meterRegistry, pool, clock);
        gnews.returning(Map.of("link", "https://a.com/bad", "title", "Broken write"))
                .returning(Map.of("link", "https://a.com/good", "title", "Oil output climbs"));

        IngestionResult result = service.ingest("energy", "gnews");

        assertThat(result.storeFailures()).isEqualTo(1);
        assertThat(result.inserted()).isEqualTo(1);
        assertThat(failing.all()).extracting(Article::getUrl).containsExactly("https://a.com/good");
        assertThat(meterRegistry.counter("ingest.store.failures", "kind", "UNAVAILABLE").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("여러 소스를 동시에 실행하고 소스 순으로 결과를 돌려준다")
    void ingestAllRunsEverySource() {
        gnews.returning(Map.of("link", "https://a.com/1", "title", "Fed holds rates steady"));
        rss.returning(Map.of("link", "https://b.com/1", "title", "Jobless claims fall"));

        List<IngestionResult> results = ingestionService.ingestAll("economy", List.of("rss", "gnews"));

        assertThat(results).extracting(IngestionResult::sourceId).containsExactly("gnews", "rss");
        assertThat(results).allMatch(IngestionResult::isSuccess);
        assertThat(store.all()).hasSize(2);
    }
}
