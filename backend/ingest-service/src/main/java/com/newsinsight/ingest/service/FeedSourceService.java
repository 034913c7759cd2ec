package com.newsinsight.ingest.service;

import com.newsinsight.ingest.dto.FeedSourceCreateRequest;
import com.newsinsight.ingest.dto.FeedSourceDTO;
import com.newsinsight.ingest.entity.FeedSource;
import com.newsinsight.ingest.mapper.EntityMapper;
import com.newsinsight.ingest.repository.FeedSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * rss 어댑터가 읽는 RSS 피드 레지스트리 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedSourceService {

    private final FeedSourceRepository feedSourceRepository;
    private final EntityMapper entityMapper;

    @Transactional(readOnly = true)
    public List<FeedSourceDTO> listFeeds(String category, boolean activeOnly) {
        List<FeedSource> feeds;
        if (category != null && !category.isBlank()) {
            feeds = activeOnly
                    ? feedSourceRepository.findByIsActiveTrueAndCategory(category)
                    : feedSourceRepository.findAll().stream()
                        .filter(feed -> category.equals(feed.getCategory()))
                        .toList();
        } else {
            feeds = activeOnly ? feedSourceRepository.findByIsActiveTrue() : feedSourceRepository.findAll();
        }
        return feeds.stream().map(entityMapper::toDTO).toList();
    }

    /**
     * 피드 등록. 같은 URL이 이미 있으면 거부한다.
     */
    @Transactional
    public FeedSourceDTO addFeed(FeedSourceCreateRequest request) {
        String url = request.url().trim();
        if (feedSourceRepository.findByUrl(url).isPresent()) {
            throw new IllegalArgumentException("Feed source already exists: " + url);
        }
        FeedSource saved = feedSourceRepository.save(entityMapper.toEntity(request));
        log.info("Added new feed source: {} ({})", saved.getName(), saved.getUrl());
        return entityMapper.toDTO(saved);
    }

    /**
     * @param active target state, or null to flip the current one
     */
    @Transactional
    public FeedSourceDTO toggleFeed(Long id, Boolean active) {
        FeedSource feed = find(id);
        boolean newState = active == null ? !Boolean.TRUE.equals(feed.getIsActive()) : active;
        feed.setIsActive(newState);
        FeedSource saved = feedSourceRepository.save(feed);
        log.info("Feed source {}: {} ({})", newState ? "activated" : "deactivated", saved.getName(), saved.getUrl());
        return entityMapper.toDTO(saved);
    }

    @Transactional
    public void removeFeed(Long id) {
        FeedSource feed = find(id);
        feedSourceRepository.delete(feed);
        log.info("Removed feed source: {} ({})", feed.getName(), feed.getUrl());
    }

    /**
     * 피드 테이블이 비어 있을 때만 기본 피드를 넣는다.
     *
     * @return number of feeds created
     */
    @Transactional
    public int initializeDefaults(List<FeedSource> defaults) {
        if (feedSourceRepository.count() > 0) {
            log.info("Feed sources already present; skipping defaults");
            return 0;
        }
        int created = 0;
        int skipped = 0;
        for (FeedSource desired : defaults) {
            if (feedSourceRepository.findByUrl(desired.getUrl()).isPresent()) {
                skipped++;
                continue;
            }
            feedSourceRepository.save(desired);
            created++;
        }
        log.info("Feed source seeding completed: created={}, skipped={}", created, skipped);
        return created;
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return feedSourceRepository.countByIsActiveTrue();
    }

    private FeedSource find(Long id) {
        return feedSourceRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Feed source not found: " + id));
    }
}
