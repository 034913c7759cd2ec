package com.newsinsight.ingest.dto;

import java.time.LocalDateTime;

public record FeedSourceDTO(
        Long id,
        String name,
        String site,
        String url,
        String category,
        Boolean isActive,
        LocalDateTime lastCollected,
        LocalDateTime createdAt
) {}
