package com.newsinsight.ingest.dto;

import java.time.LocalDateTime;
import java.util.Set;

public record TopicDTO(
        Long id,
        String query,
        String category,
        Integer priority,
        Boolean isActive,
        Set<String> sources,
        Long updateFrequencySeconds,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public TopicDTO {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
    }
}
