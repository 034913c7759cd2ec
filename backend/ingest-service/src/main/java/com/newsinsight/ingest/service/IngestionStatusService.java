package com.newsinsight.ingest.service;

import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.dto.IngestionStatusDTO;
import com.newsinsight.ingest.repository.FeedSourceRepository;
import com.newsinsight.ingest.repository.TopicRepository;
import com.newsinsight.ingest.scheduler.TopicScheduler;
import com.newsinsight.ingest.service.resilience.SourceHealthRegistry;
import com.newsinsight.ingest.store.ArticleStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;

/**
 * 수집 현황: 기사 통계, 작업 집합, 소스별 회로 상태
 */
@Service
@RequiredArgsConstructor
public class IngestionStatusService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final ArticleStore articleStore;
    private final TopicRepository topicRepository;
    private final FeedSourceRepository feedSourceRepository;
    private final TopicScheduler topicScheduler;
    private final SourceHealthRegistry healthRegistry;
    private final IngestionService ingestionService;
    private final IngestProperties properties;

    @Transactional(readOnly = true)
    public IngestionStatusDTO status() {
        return new IngestionStatusDTO(
                properties.getScheduler().isEnabled(),
                articleStore.count(),
                articleStore.countDistinctSources(),
                articleStore.countRecent(RECENT_WINDOW),
                topicRepository.count(),
                topicRepository.countByIsActiveTrue(),
                feedSourceRepository.countByIsActiveTrue(),
                topicScheduler.currentJobs(),
                topicScheduler.getLastRefreshAt().orElse(null),
                topicScheduler.getLastFailure().map(Throwable::getMessage).orElse(null),
                topicScheduler.getLastFailureAt().orElse(null),
                healthRegistry.snapshots(),
                ingestionService.lastRuns()
        );
    }
}
