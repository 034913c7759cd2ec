package com.newsinsight.ingest.service;

import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.store.InMemoryArticleStore;
import com.newsinsight.ingest.store.UpsertResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ArticleDeduplicationService 단위 테스트
 */
class ArticleDeduplicationServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private MutableClock clock;
    private InMemoryArticleStore store;
    private IngestProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryArticleStore(clock);
        properties = new IngestProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    private ArticleDeduplicationService service() {
        return new ArticleDeduplicationService(store, properties, meterRegistry, clock);
    }

    private static Article article(String url, String title) {
        return Article.builder()
                .url(url)
                .title(title)
                .body("")
                .publishedAt(T0)
                .source("gnews")
                .build();
    }

    @Test
    @DisplayName("같은 URL을 반복 저장해도 레코드는 하나이고 최신 필드가 남는다")
    void sameUrlIsIdempotent() {
        ArticleDeduplicationService service = service();

        assertThat(service.upsert(article("https://a.com/1", "First title"))).isEqualTo(UpsertResult.INSERTED);
        clock.advance(Duration.ofMinutes(5));
        assertThat(service.upsert(article("https://a.com/1", "Edited title"))).isEqualTo(UpsertResult.UPDATED);

        assertThat(store.all()).hasSize(1);
        Article stored = store.findByUrl("https://a.com/1").orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("Edited title");
        assertThat(stored.getCollectedAt()).isEqualTo(T0);
        assertThat(stored.getUpdatedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("다른 URL이지만 제목 유사도가 임계값을 넘으면 저장하지 않는다")
    void suppressesNearDuplicateTitle() {
        ArticleDeduplicationService service = service();
        service.upsert(article("https://a.com/fed", "Fed Raises Rates Again"));

        UpsertResult result = service.upsert(article("https://b.com/fed", "Fed Raises Rates Again Today"));

        assertThat(result).isEqualTo(UpsertResult.SUPPRESSED);
        assertThat(store.all()).extracting(Article::getUrl).containsExactly("https://a.com/fed");
        assertThat(meterRegistry.counter("ingest.articles.upserts",
                "source", "gnews", "result", "SUPPRESSED").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("임계값을 낮추면 중간 단어가 추가된 제목도 중복으로 본다")
    void thresholdIsConfigurable() {
        // 유사도 44/53 = 0.830
        ArticleDeduplicationService defaults = service();
        defaults.upsert(article("https://a.com/fed", "Fed Raises Rates Again"));
        assertThat(defaults.upsert(article("https://b.com/fed", "Fed Raises Interest Rates Again")))
                .isEqualTo(UpsertResult.INSERTED);

        store = new InMemoryArticleStore(clock);
        properties.getDedup().setSimilarityThreshold(0.80);
        ArticleDeduplicationService lenient = service();
        lenient.upsert(article("https://a.com/fed", "Fed Raises Rates Again"));
        assertThat(lenient.upsert(article("https://b.com/fed", "Fed Raises Interest Rates Again")))
                .isEqualTo(UpsertResult.SUPPRESSED);
    }

    @Test
    @DisplayName("관련 없는 제목은 둘 다 저장")
    void unrelatedTitlesAreKept() {
        ArticleDeduplicationService service = service();

        service.upsert(article("https://a.com/1", "Oil prices slump as OPEC output rises"));
        service.upsert(article("https://a.com/2", "Tech stocks rally on earnings beat"));

        assertThat(store.all()).hasSize(2);
    }

    @Test
    @DisplayName("윈도우 밖에서 수집된 기사와는 비교하지 않는다")
    void comparesOnlyWithinWindow() {
        ArticleDeduplicationService service = service();
        service.upsert(article("https://a.com/fed", "Fed Raises Rates Again"));

        clock.advance(Duration.ofHours(25));
        UpsertResult result = service.upsert(article("https://b.com/fed", "Fed Raises Rates Again Today"));

        assertThat(result).isEqualTo(UpsertResult.INSERTED);
        assertThat(store.all()).hasSize(2);
    }

    @Test
    @DisplayName("이미 저장된 URL은 제목이 유사해도 갱신된다")
    void existingUrlBypassesSimilarity() {
        ArticleDeduplicationService service = service();
        service.upsert(article("https://a.com/fed", "Fed Raises Rates Again"));
        service.upsert(article("https://b.com/other", "Completely different headline"));

        UpsertResult result = service.upsert(article("https://b.com/other", "Fed Raises Rates Again!"));

        assertThat(result).isEqualTo(UpsertResult.UPDATED);
    }

    @Test
    @DisplayName("유사 제목을 동시에 저장해도 하나만 남는다")
    void concurrentNearDuplicatesLeaveOne() throws Exception {
        ArticleDeduplicationService service = service();
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UpsertResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String url = "https://site" + i + ".com/fed";
                String title = "Fed Raises Rates Again" + " ".repeat(i % 2);
                Callable<UpsertResult> task = () -> {
                    start.await();
                    return service.upsert(article(url, title));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            List<UpsertResult> results = new ArrayList<>();
            for (Future<UpsertResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(r -> r == UpsertResult.INSERTED).hasSize(1);
            assertThat(results).filteredOn(r -> r == UpsertResult.SUPPRESSED).hasSize(writers - 1);
            assertThat(store.all()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    static class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
