package com.newsinsight.ingest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "topics", indexes = {
    @Index(name = "uk_topics_query", columnList = "query_text", unique = true),
    @Index(name = "idx_topics_active_priority", columnList = "is_active, priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Topic {

    public static final String DEFAULT_CATEGORY = "general";
    public static final int DEFAULT_PRIORITY = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "query_text", nullable = false, length = 255)
    private String query;

    @Column(name = "category", nullable = false, length = 100)
    @Builder.Default
    private String category = DEFAULT_CATEGORY;

    /** Lower number = higher priority */
    @Column(name = "priority", nullable = false)
    @Builder.Default
    private Integer priority = DEFAULT_PRIORITY;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "topic_sources", joinColumns = @JoinColumn(name = "topic_id"))
    @Column(name = "source_id", nullable = false, length = 100)
    @Builder.Default
    private Set<String> sources = new LinkedHashSet<>();

    @Column(name = "update_frequency_seconds")
    private Long updateFrequencySeconds;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Topic frequency, or the given fallback when none is configured.
     */
    public Duration getUpdateFrequencyOr(Duration fallback) {
        if (updateFrequencySeconds == null || updateFrequencySeconds <= 0) {
            return fallback;
        }
        return Duration.ofSeconds(updateFrequencySeconds);
    }

    public boolean isActiveTopic() {
        return Boolean.TRUE.equals(isActive);
    }
}
