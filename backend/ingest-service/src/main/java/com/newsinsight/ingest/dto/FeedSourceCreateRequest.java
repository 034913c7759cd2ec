package com.newsinsight.ingest.dto;

import jakarta.validation.constraints.NotBlank;

public record FeedSourceCreateRequest(
        @NotBlank(message = "Name is required") String name,
        String site,
        @NotBlank(message = "URL is required") String url,
        String category,
        Boolean active
) {
    public FeedSourceCreateRequest {
        category = category == null || category.isBlank() ? "general" : category;
        active = active == null ? Boolean.TRUE : active;
    }
}
