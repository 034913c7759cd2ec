package com.newsinsight.ingest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "articles", indexes = {
    @Index(name = "uk_articles_url", columnList = "url", unique = true),
    @Index(name = "idx_articles_published_at", columnList = "published_at"),
    @Index(name = "idx_articles_collected_at", columnList = "collected_at"),
    @Index(name = "idx_articles_source", columnList = "source")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Canonical URL, globally unique */
    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "published_at", nullable = false)
    private Instant publishedAt;

    @Column(name = "source", nullable = false, length = 255)
    private String source;

    @Column(name = "search_key", length = 255)
    private String searchKey;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Convert(converter = KeywordListConverter.class)
    @Column(name = "keywords", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    // 최초 수집 시각 (upsert 시 유지)
    @Column(name = "collected_at", nullable = false, updatable = false)
    private Instant collectedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
