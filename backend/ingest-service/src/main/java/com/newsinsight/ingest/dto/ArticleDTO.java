package com.newsinsight.ingest.dto;

import java.time.Instant;
import java.util.List;

public record ArticleDTO(
        Long id,
        String url,
        String title,
        String body,
        Instant publishedAt,
        String source,
        String searchKey,
        String imageUrl,
        List<String> keywords,
        Instant collectedAt,
        Instant updatedAt
) {
    public ArticleDTO {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
