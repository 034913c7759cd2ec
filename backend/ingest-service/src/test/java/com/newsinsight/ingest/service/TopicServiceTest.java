package com.newsinsight.ingest.service;

import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.client.StubFetcher;
import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.dto.TopicCreateRequest;
import com.newsinsight.ingest.dto.TopicDTO;
import com.newsinsight.ingest.dto.TopicUpdateRequest;
import com.newsinsight.ingest.entity.Topic;
import com.newsinsight.ingest.exception.TopicNotFoundException;
import com.newsinsight.ingest.mapper.EntityMapper;
import com.newsinsight.ingest.repository.TopicRepository;
import com.newsinsight.ingest.scheduler.TopicScheduler;
import com.newsinsight.ingest.scheduler.TopicsChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TopicService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class TopicServiceTest {

    @Mock
    private TopicRepository topicRepository;

    @Mock
    private TopicScheduler topicScheduler;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private TopicService topicService;

    @BeforeEach
    void setUp() {
        FetcherRegistry registry = new FetcherRegistry(List.of(
                new StubFetcher("gnews"), new StubFetcher("rss"), new StubFetcher("web", true)));
        topicService = new TopicService(topicRepository, topicScheduler, ingestionService, registry,
                eventPublisher, new IngestProperties(), new EntityMapper());
    }

    private static Topic topic(String query, String... sources) {
        return Topic.builder()
                .id(1L)
                .query(query)
                .sources(new LinkedHashSet<>(List.of(sources)))
                .build();
    }

    @Nested
    @DisplayName("addTopic")
    class AddTopic {

        @Test
        @DisplayName("새 토픽은 기본값으로 저장되고 ADDED 이벤트를 발행한다")
        void createsTopicWithDefaults() {
            // given
            when(topicRepository.findByQuery("inflation")).thenReturn(Optional.empty());
            when(topicRepository.save(any(Topic.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // when
            TopicDTO dto = topicService.addTopic(new TopicCreateRequest("  inflation ", null, null, null, null, null));

            // then
            assertThat(dto.query()).isEqualTo("inflation");
            assertThat(dto.category()).isEqualTo(Topic.DEFAULT_CATEGORY);
            assertThat(dto.priority()).isEqualTo(Topic.DEFAULT_PRIORITY);
            assertThat(dto.isActive()).isTrue();
            assertThat(dto.sources()).containsExactlyInAnyOrder("gnews", "rss");
            verify(eventPublisher).publishEvent(new TopicsChangedEvent("inflation", TopicsChangedEvent.Change.ADDED));
        }

        @Test
        @DisplayName("같은 질의어가 있으면 갱신하고 UPDATED 이벤트를 발행한다")
        void upsertsExistingTopic() {
            Topic existing = topic("inflation", "gnews");
            when(topicRepository.findByQuery("inflation")).thenReturn(Optional.of(existing));
            when(topicRepository.save(existing)).thenReturn(existing);

            TopicDTO dto = topicService.addTopic(
                    new TopicCreateRequest("inflation", "economy", 1, Set.of("web"), 600L, true));

            assertThat(dto.id()).isEqualTo(1L);
            assertThat(dto.category()).isEqualTo("economy");
            assertThat(dto.priority()).isEqualTo(1);
            assertThat(dto.sources()).containsExactly("web");
            assertThat(dto.updateFrequencySeconds()).isEqualTo(600L);
            verify(eventPublisher).publishEvent(new TopicsChangedEvent("inflation", TopicsChangedEvent.Change.UPDATED));
        }

        @Test
        @DisplayName("알 수 없는 소스는 거부")
        void rejectsUnknownSource() {
            assertThatThrownBy(() -> topicService.addTopic(
                    new TopicCreateRequest("inflation", null, null, Set.of("twitter"), null, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("twitter");
            verify(topicRepository, never()).save(any());
        }

        @Test
        @DisplayName("빈 질의어는 거부")
        void rejectsBlankQuery() {
            assertThatThrownBy(() -> topicService.addTopic(
                    new TopicCreateRequest("  ", null, null, null, null, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Topic query cannot be empty");
        }
    }

    @Test
    @DisplayName("삭제는 스케줄에서 먼저 내린 뒤 진행한다")
    void removeUnschedulesFirst() {
        Topic existing = topic("inflation", "gnews");
        when(topicRepository.findByQuery("inflation")).thenReturn(Optional.of(existing));

        topicService.removeTopic("inflation");

        InOrder order = inOrder(topicScheduler, topicRepository, eventPublisher);
        order.verify(topicScheduler).unschedule("inflation");
        order.verify(topicRepository).delete(existing);
        order.verify(eventPublisher).publishEvent(new TopicsChangedEvent("inflation", TopicsChangedEvent.Change.REMOVED));
    }

    @Test
    @DisplayName("없는 토픽 삭제는 TopicNotFoundException")
    void removeMissingTopic() {
        when(topicRepository.findByQuery("nothing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> topicService.removeTopic("nothing"))
                .isInstanceOf(TopicNotFoundException.class);
        verify(topicScheduler, never()).unschedule(anyString());
    }

    @Test
    @DisplayName("toggle은 값이 없으면 현재 상태를 뒤집는다")
    void toggleFlipsState() {
        Topic existing = topic("inflation", "gnews");
        when(topicRepository.findByQuery("inflation")).thenReturn(Optional.of(existing));
        when(topicRepository.save(existing)).thenReturn(existing);

        assertThat(topicService.toggleTopic("inflation", null).isActive()).isFalse();
        assertThat(topicService.toggleTopic("inflation", false).isActive()).isFalse();
        assertThat(topicService.toggleTopic("inflation", null).isActive()).isTrue();
        verify(eventPublisher, times(3)).publishEvent(any(TopicsChangedEvent.class));
    }

    @Nested
    @DisplayName("부분 갱신")
    class Updates {

        @Test
        @DisplayName("잘못된 우선순위, 카테고리, 주기는 거부")
        void validatesArguments() {
            assertThatThrownBy(() -> topicService.updatePriority("inflation", 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> topicService.updateCategory("inflation", " "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> topicService.updateFrequency("inflation", 59))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("지정된 필드만 바꾼다")
        void updatesOnlyGivenFields() {
            Topic existing = topic("inflation", "gnews");
            existing.setCategory("economy");
            when(topicRepository.findByQuery("inflation")).thenReturn(Optional.of(existing));
            when(topicRepository.save(existing)).thenReturn(existing);

            TopicDTO dto = topicService.update("inflation", new TopicUpdateRequest(null, 2, Set.of("rss"), null));

            assertThat(dto.category()).isEqualTo("economy");
            assertThat(dto.priority()).isEqualTo(2);
            assertThat(dto.sources()).containsExactly("rss");
        }
    }

    @Test
    @DisplayName("토픽이 있으면 기본 카탈로그를 넣지 않는다")
    void initializeDefaultsOnlyWhenEmpty() {
        when(topicRepository.count()).thenReturn(3L);

        assertThat(topicService.initializeDefaults(Map.of("markets", List.of("stocks")))).isZero();
        verify(topicRepository, never()).save(any());
    }

    @Test
    @DisplayName("빈 테이블에는 카탈로그 전체를 넣고 SEEDED 이벤트를 한 번 발행한다")
    void initializeDefaultsSeedsCatalogue() {
        Map<String, List<String>> catalogue = new LinkedHashMap<>();
        catalogue.put("markets", List.of("stocks", "bonds"));
        catalogue.put("commodities", List.of("gold"));
        when(topicRepository.count()).thenReturn(0L);
        when(topicRepository.existsByQuery(anyString())).thenReturn(false);

        int created = topicService.initializeDefaults(catalogue);

        assertThat(created).isEqualTo(3);
        ArgumentCaptor<Topic> saved = ArgumentCaptor.forClass(Topic.class);
        verify(topicRepository, times(3)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(Topic::getCategory)
                .containsExactly("markets", "markets", "commodities");
        verify(eventPublisher).publishEvent(new TopicsChangedEvent("*", TopicsChangedEvent.Change.SEEDED));
    }

    @Test
    @DisplayName("즉시 수집은 없는 토픽을 ondemand 최우선 토픽으로 등록하고 모든 소스를 실행한다")
    void runNowCreatesOnDemandTopic() {
        when(topicRepository.findByQuery("copper")).thenReturn(Optional.empty());
        when(topicRepository.save(any(Topic.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(ingestionService.ingestAll(anyString(), any())).thenReturn(List.of());

        topicService.runNow(" copper ");

        ArgumentCaptor<Topic> saved = ArgumentCaptor.forClass(Topic.class);
        verify(topicRepository).save(saved.capture());
        assertThat(saved.getValue().getCategory()).isEqualTo(TopicService.ON_DEMAND_CATEGORY);
        assertThat(saved.getValue().getPriority()).isEqualTo(TopicService.ON_DEMAND_PRIORITY);
        verify(ingestionService).ingestAll("copper", Set.of("gnews", "rss"));
    }
}
