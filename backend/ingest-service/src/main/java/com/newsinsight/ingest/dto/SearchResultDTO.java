package com.newsinsight.ingest.dto;

public record SearchResultDTO(
        ArticleDTO article,
        double score
) {}
