package com.newsinsight.ingest.service;

import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.store.ArticleFilter;
import com.newsinsight.ingest.store.ArticleStore;
import com.newsinsight.ingest.store.UpsertResult;
import com.newsinsight.ingest.util.TitleSimilarity;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 중복 제거 저장 게이트웨이.
 *
 * 1차 키는 정규화된 URL이다. 이미 저장된 URL은 최신 필드로 덮어쓴다.
 * 새 URL은 최근 윈도우 안에 수집된 기사 제목과 비교해 유사도가 임계값을 넘으면 저장하지 않는다.
 */
@Service
@Slf4j
public class ArticleDeduplicationService {

    private final ArticleStore articleStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final double similarityThreshold;
    private final Duration window;

    // 새 URL의 확인-후-삽입 구간 직렬화 (유사 제목 두 건이 동시에 남지 않도록)
    private final ReentrantLock insertLock = new ReentrantLock();

    public ArticleDeduplicationService(ArticleStore articleStore,
                                       IngestProperties properties,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        this.articleStore = articleStore;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.similarityThreshold = properties.getDedup().getSimilarityThreshold();
        this.window = properties.getDedup().getWindow();
    }

    /**
     * @throws com.newsinsight.ingest.exception.StoreException when the store fails
     */
    public UpsertResult upsert(Article article) {
        if (articleStore.findByUrl(article.getUrl()).isPresent()) {
            return record(articleStore.upsertByUrl(article), article);
        }

        insertLock.lock();
        try {
            // 대기 중 다른 파이프라인이 같은 URL을 저장했을 수 있음
            if (articleStore.findByUrl(article.getUrl()).isPresent()) {
                return record(articleStore.upsertByUrl(article), article);
            }
            Optional<Article> duplicate = findNearDuplicate(article.getTitle());
            if (duplicate.isPresent()) {
                log.debug("Suppressed '{}' ({}) as near-duplicate of '{}' ({})",
                        article.getTitle(), article.getUrl(), duplicate.get().getTitle(), duplicate.get().getUrl());
                return record(UpsertResult.SUPPRESSED, article);
            }
            return record(articleStore.upsertByUrl(article), article);
        } finally {
            insertLock.unlock();
        }
    }

    /**
     * First article collected within the window whose title scores strictly above the threshold.
     */
    public Optional<Article> findNearDuplicate(String title) {
        return articleStore.find(ArticleFilter.collectedSince(clock.instant().minus(window))).stream()
                .filter(existing -> TitleSimilarity.ratio(title, existing.getTitle()) > similarityThreshold)
                .findFirst();
    }

    private UpsertResult record(UpsertResult result, Article article) {
        meterRegistry.counter("ingest.articles.upserts",
                "source", article.getSource(), "result", result.name()).increment();
        return result;
    }
}
