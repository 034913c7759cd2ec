package com.newsinsight.ingest.dto;

import com.newsinsight.ingest.entity.Topic;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Set;

/**
 * 토픽 추가 요청. 같은 질의어의 토픽이 있으면 갱신된다.
 * sources가 비어 있으면 기본 소스 집합이 쓰인다.
 */
public record TopicCreateRequest(
        @NotBlank(message = "Query is required") String query,
        String category,
        @Min(value = 1, message = "Priority must be at least 1") Integer priority,
        Set<String> sources,
        @Min(value = 60, message = "Update frequency must be at least 60 seconds") Long updateFrequencySeconds,
        Boolean active
) {
    public TopicCreateRequest {
        category = category == null || category.isBlank() ? Topic.DEFAULT_CATEGORY : category;
        priority = priority == null ? Topic.DEFAULT_PRIORITY : priority;
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        active = active == null ? Boolean.TRUE : active;
    }
}
