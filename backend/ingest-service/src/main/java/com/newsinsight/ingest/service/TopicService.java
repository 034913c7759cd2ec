package com.newsinsight.ingest.service;

import com.newsinsight.ingest.client.FetcherRegistry;
import com.newsinsight.ingest.config.IngestProperties;
import com.newsinsight.ingest.dto.IngestionResult;
import com.newsinsight.ingest.dto.TopicCreateRequest;
import com.newsinsight.ingest.dto.TopicDTO;
import com.newsinsight.ingest.dto.TopicUpdateRequest;
import com.newsinsight.ingest.entity.Topic;
import com.newsinsight.ingest.exception.TopicNotFoundException;
import com.newsinsight.ingest.mapper.EntityMapper;
import com.newsinsight.ingest.repository.TopicRepository;
import com.newsinsight.ingest.scheduler.TopicScheduler;
import com.newsinsight.ingest.scheduler.TopicsChangedEvent;
import com.newsinsight.ingest.scheduler.TopicsChangedEvent.Change;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 토픽 관리. 변경은 커밋 후 {@link TopicsChangedEvent}로 스케줄러에 전달된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicService {

    public static final String ON_DEMAND_CATEGORY = "ondemand";
    public static final int ON_DEMAND_PRIORITY = 1;

    private final TopicRepository topicRepository;
    private final TopicScheduler topicScheduler;
    private final IngestionService ingestionService;
    private final FetcherRegistry fetcherRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final IngestProperties properties;
    private final EntityMapper entityMapper;

    /**
     * 토픽 목록 (우선순위 순)
     */
    @Transactional(readOnly = true)
    public List<TopicDTO> listTopics(String category, boolean includeInactive) {
        List<Topic> topics;
        if (category == null || category.isBlank()) {
            topics = includeInactive
                    ? topicRepository.findAllByOrderByPriorityAscIdAsc()
                    : topicRepository.findByIsActiveTrueOrderByPriorityAscIdAsc();
        } else {
            topics = includeInactive
                    ? topicRepository.findByCategoryOrderByPriorityAscIdAsc(category)
                    : topicRepository.findByCategoryAndIsActiveTrueOrderByPriorityAscIdAsc(category);
        }
        return topics.stream().map(entityMapper::toDTO).toList();
    }

    @Transactional(readOnly = true)
    public TopicDTO getTopic(String query) {
        return entityMapper.toDTO(find(query));
    }

    /**
     * 토픽 추가. 같은 질의어가 있으면 카테고리, 우선순위, 활성 상태, 소스, 주기를 갱신한다.
     */
    @Transactional
    public TopicDTO addTopic(TopicCreateRequest request) {
        String query = requireQuery(request.query());
        Set<String> sources = resolveSources(request.sources());

        Topic saved = topicRepository.findByQuery(query)
                .map(existing -> {
                    existing.setCategory(request.category());
                    existing.setPriority(request.priority());
                    existing.setIsActive(request.active());
                    existing.setSources(new LinkedHashSet<>(sources));
                    existing.setUpdateFrequencySeconds(request.updateFrequencySeconds());
                    Topic updated = topicRepository.save(existing);
                    log.info("Updated topic: query={}, priority={}, sources={}", query, updated.getPriority(), sources);
                    eventPublisher.publishEvent(new TopicsChangedEvent(query, Change.UPDATED));
                    return updated;
                })
                .orElseGet(() -> {
                    Topic created = topicRepository.save(entityMapper.toEntity(request, sources));
                    log.info("Added topic: query={}, priority={}, sources={}", query, created.getPriority(), sources);
                    eventPublisher.publishEvent(new TopicsChangedEvent(query, Change.ADDED));
                    return created;
                });
        return entityMapper.toDTO(saved);
    }

    /**
     * 스케줄에서 먼저 내린 뒤 삭제한다. 진행 중인 실행은 끝까지 돈다.
     */
    @Transactional
    public void removeTopic(String query) {
        Topic topic = find(query);
        topicScheduler.unschedule(topic.getQuery());
        topicRepository.delete(topic);
        log.info("Removed topic: query={}", topic.getQuery());
        eventPublisher.publishEvent(new TopicsChangedEvent(topic.getQuery(), Change.REMOVED));
    }

    /**
     * @param active target state, or null to flip the current one
     */
    @Transactional
    public TopicDTO toggleTopic(String query, Boolean active) {
        Topic topic = find(query);
        boolean newState = active == null ? !topic.isActiveTopic() : active;
        topic.setIsActive(newState);
        Topic saved = topicRepository.save(topic);
        log.info("Topic {}: {}", newState ? "activated" : "deactivated", query);
        eventPublisher.publishEvent(new TopicsChangedEvent(query, Change.TOGGLED));
        return entityMapper.toDTO(saved);
    }

    @Transactional
    public TopicDTO updatePriority(String query, int priority) {
        if (priority < 1) {
            throw new IllegalArgumentException("Priority must be at least 1");
        }
        return update(query, new TopicUpdateRequest(null, priority, null, null));
    }

    @Transactional
    public TopicDTO updateCategory(String query, String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be empty");
        }
        return update(query, new TopicUpdateRequest(category, null, null, null));
    }

    @Transactional
    public TopicDTO updateFrequency(String query, long updateFrequencySeconds) {
        if (updateFrequencySeconds < 60) {
            throw new IllegalArgumentException("Update frequency must be at least 60 seconds");
        }
        return update(query, new TopicUpdateRequest(null, null, null, updateFrequencySeconds));
    }

    @Transactional
    public TopicDTO update(String query, TopicUpdateRequest request) {
        Topic topic = find(query);
        if (request.category() != null && !request.category().isBlank()) {
            topic.setCategory(request.category());
        }
        if (request.priority() != null) {
            topic.setPriority(request.priority());
        }
        if (request.sources() != null) {
            topic.setSources(new LinkedHashSet<>(resolveSources(request.sources())));
        }
        if (request.updateFrequencySeconds() != null) {
            topic.setUpdateFrequencySeconds(request.updateFrequencySeconds());
        }
        Topic saved = topicRepository.save(topic);
        log.info("Updated topic: query={}, category={}, priority={}, frequency={}s",
                query, saved.getCategory(), saved.getPriority(), saved.getUpdateFrequencySeconds());
        eventPublisher.publishEvent(new TopicsChangedEvent(query, Change.UPDATED));
        return entityMapper.toDTO(saved);
    }

    /**
     * 토픽 테이블이 비어 있을 때만 기본 카탈로그를 넣는다.
     *
     * @return number of topics created
     */
    @Transactional
    public int initializeDefaults(Map<String, List<String>> catalogue) {
        if (topicRepository.count() > 0) {
            log.info("Topics already present; skipping default catalogue");
            return 0;
        }
        Set<String> sources = resolveSources(Set.of());
        int created = 0;
        for (Map.Entry<String, List<String>> category : catalogue.entrySet()) {
            for (String query : category.getValue()) {
                if (topicRepository.existsByQuery(query)) {
                    continue;
                }
                topicRepository.save(Topic.builder()
                        .query(query)
                        .category(category.getKey())
                        .priority(Topic.DEFAULT_PRIORITY)
                        .isActive(true)
                        .sources(new LinkedHashSet<>(sources))
                        .build());
                created++;
            }
        }
        log.info("Initialized {} default topics", created);
        eventPublisher.publishEvent(new TopicsChangedEvent("*", Change.SEEDED));
        return created;
    }

    /**
     * 즉시 수집. 토픽이 없으면 최우선(ondemand) 토픽으로 등록한 뒤 모든 소스를 바로 실행한다.
     */
    public List<IngestionResult> runNow(String rawQuery) {
        String query = requireQuery(rawQuery);
        Topic topic = topicRepository.findByQuery(query).orElseGet(() -> {
            Topic created = topicRepository.save(Topic.builder()
                    .query(query)
                    .category(ON_DEMAND_CATEGORY)
                    .priority(ON_DEMAND_PRIORITY)
                    .isActive(true)
                    .sources(new LinkedHashSet<>(resolveSources(Set.of())))
                    .build());
            log.info("On-the-fly search for: {}", query);
            eventPublisher.publishEvent(new TopicsChangedEvent(query, Change.ADDED));
            return created;
        });
        return ingestionService.ingestAll(query, topic.getSources());
    }

    private Topic find(String query) {
        return topicRepository.findByQuery(requireQuery(query))
                .orElseThrow(() -> new TopicNotFoundException(query));
    }

    private Set<String> resolveSources(Set<String> requested) {
        Set<String> sources = requested == null || requested.isEmpty()
                ? new LinkedHashSet<>(properties.getSeed().getDefaultTopicSources())
                : new LinkedHashSet<>(requested);
        for (String source : sources) {
            if (!fetcherRegistry.contains(source)) {
                throw new IllegalArgumentException("Unknown source '" + source + "'; known: " + fetcherRegistry.sourceIds());
            }
        }
        return sources;
    }

    private static String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Topic query cannot be empty");
        }
        return query.trim();
    }
}
