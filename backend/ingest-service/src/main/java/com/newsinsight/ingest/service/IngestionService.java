package com.newsinsight.ingest.service;

import com.newsinsight.ingest.client.ArticleFetcher;
import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.client.RawArticle;
import com.newsinsight.ingest.dto.IngestionResult;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.exception.FetchException;
import com.newsinsight.ingest.exception.StoreException;
import com.newsinsight.ingest.service.resilience.FetchOutcome;
import com.newsinsight.ingest.service.resilience.ResilientFetchExecutor;
import com.newsinsight.ingest.store.UpsertResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 수집 파이프라인: 어댑터 호출 → 정규화 → 중복 제거 저장.
 *
 * 레코드 단위 실패(정규화, 저장)는 집계만 하고 나머지 레코드 처리를 계속한다.
 */
@Service
@Slf4j
public class IngestionService {

    private final FetcherRegistry fetcherRegistry;
    private final ResilientFetchExecutor fetchExecutor;
    private final ArticleNormalizer normalizer;
    private final ArticleDeduplicationService deduplicationService;
    private final MeterRegistry meterRegistry;
    private final Executor pipelineExecutor;
    private final Clock clock;

    private final Map<String, IngestionResult> lastRuns = new ConcurrentHashMap<>();

    public IngestionService(FetcherRegistry fetcherRegistry,
                            ResilientFetchExecutor fetchExecutor,
                            ArticleNormalizer normalizer,
                            ArticleDeduplicationService deduplicationService,
                            MeterRegistry meterRegistry,
                            @Qualifier("pipelineExecutor") Executor pipelineExecutor,
                            Clock clock) {
        this.fetcherRegistry = fetcherRegistry;
        this.fetchExecutor = fetchExecutor;
        this.normalizer = normalizer;
        this.deduplicationService = deduplicationService;
        this.meterRegistry = meterRegistry;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    /**
     * Runs one (topic, source) pipeline on the calling thread.
     */
    public IngestionResult ingest(String topicQuery, String sourceId) {
        Instant startedAt = clock.instant();
        Optional<ArticleFetcher> fetcher = fetcherRegistry.find(sourceId);
        if (fetcher.isEmpty()) {
            log.warn("No fetcher registered for source {}; skipping '{}'", sourceId, topicQuery);
            return remember(IngestionResult.failed(topicQuery, sourceId, startedAt, clock.instant(),
                    null, "Unknown source " + sourceId));
        }

        log.info("{} news updating from {}...", topicQuery, sourceId);
        Duration deadline = fetchExecutor.callTimeout();
        FetchOutcome<List<RawArticle>> outcome =
                fetchExecutor.call(sourceId, () -> fetcher.get().fetch(topicQuery, deadline));
        if (!outcome.isSuccess()) {
            FetchException error = outcome.error().orElseThrow();
            return remember(IngestionResult.failed(topicQuery, sourceId, startedAt, clock.instant(),
                    error.getType(), error.getMessage()));
        }

        List<RawArticle> raws = outcome.getValue();
        meterRegistry.counter("ingest.records.fetched", "source", sourceId).increment(raws.size());
        List<Article> articles = normalizer.normalizeAll(raws, sourceId);

        int inserted = 0;
        int updated = 0;
        int suppressed = 0;
        int storeFailures = 0;
        for (Article article : articles) {
            try {
                UpsertResult result = deduplicationService.upsert(article);
                switch (result) {
                    case INSERTED -> inserted++;
                    case UPDATED -> updated++;
                    case SUPPRESSED -> suppressed++;
                }
            } catch (StoreException e) {
                // 한 건의 저장 실패가 같은 배치의 나머지를 막지 않는다
                storeFailures++;
                meterRegistry.counter("ingest.store.failures", "kind", e.getKind().name()).increment();
                log.error("Failed to store article {} from {}: {}", article.getUrl(), sourceId, e.getMessage(), e);
            }
        }

        IngestionResult result = new IngestionResult(topicQuery, sourceId, startedAt, clock.instant(),
                raws.size(), raws.size() - articles.size(), inserted, updated, suppressed, storeFailures,
                null, null);
        log.info("{} news updated from {} - fetched={}, inserted={}, updated={}, suppressed={}, dropped={}, storeFailures={}",
                topicQuery, sourceId, result.fetched(), inserted, updated, suppressed, result.dropped(), storeFailures);
        return remember(result);
    }

    /**
     * Runs the given sources for one query concurrently on the pipeline pool and waits for all of them.
     */
    public List<IngestionResult> ingestAll(String topicQuery, Collection<String> sourceIds) {
        List<CompletableFuture<IngestionResult>> futures = sourceIds.stream()
                .sorted()
                .map(sourceId -> CompletableFuture.supplyAsync(() -> ingest(topicQuery, sourceId), pipelineExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Last result per "topic|source", sorted by key.
     */
    public Map<String, IngestionResult> lastRuns() {
        return new TreeMap<>(lastRuns);
    }

    private IngestionResult remember(IngestionResult result) {
        lastRuns.put(result.topicQuery() + "|" + result.sourceId(), result);
        return result;
    }
}
