package com.newsinsight.ingest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * RSS 피드 등록 정보. rss 소스 어댑터가 토픽 수집 시 활성 피드를 모두 읽는다.
 */
@Entity
@Table(name = "feed_sources", indexes = {
    @Index(name = "uk_feed_sources_url", columnList = "url", unique = true),
    @Index(name = "idx_feed_sources_is_active", columnList = "is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedSource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Publisher name, e.g. "Bloomberg"; carried on fetched records as the publisher field */
    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "site", length = 255)
    private String site;

    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "category", nullable = false, length = 100)
    @Builder.Default
    private String category = "general";

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "last_collected")
    private LocalDateTime lastCollected;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
