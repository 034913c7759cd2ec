package com.newsinsight.ingest;

import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.repository.FeedSourceRepository;
import com.newsinsight.ingest.repository.TopicRepository;
import com.newsinsight.ingest.scheduler.TopicScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Application context 로드 테스트
 */
@SpringBootTest
@ActiveProfiles("test")
class IngestApplicationTests {

    @Autowired
    private FetcherRegistry fetcherRegistry;

    @Autowired
    private TopicRepository topicRepository;

    @Autowired
    private FeedSourceRepository feedSourceRepository;

    @Autowired
    private TopicScheduler topicScheduler;

    @Test
    @DisplayName("Spring context 로드 및 기본 데이터 시드")
    void contextLoads() {
        assertThat(fetcherRegistry.sourceIds()).containsExactly("gnews", "rss", "web");
        assertThat(topicRepository.count()).isPositive();
        assertThat(feedSourceRepository.count()).isEqualTo(10);
        // 테스트 프로필에서는 스케줄링이 꺼져 있다
        assertThat(topicScheduler.currentJobs()).isEmpty();
    }
}
