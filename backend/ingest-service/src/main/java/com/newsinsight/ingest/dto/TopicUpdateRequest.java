package com.newsinsight.ingest.dto;

import jakarta.validation.constraints.Min;

import java.util.Set;

/**
 * 부분 수정. null 필드는 변경하지 않는다.
 */
public record TopicUpdateRequest(
        String category,
        @Min(value = 1, message = "Priority must be at least 1") Integer priority,
        Set<String> sources,
        @Min(value = 60, message = "Update frequency must be at least 60 seconds") Long updateFrequencySeconds
) {}
