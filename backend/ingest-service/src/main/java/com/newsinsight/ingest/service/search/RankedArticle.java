package com.newsinsight.ingest.service.search;

import com.newsinsight.ingest.entity.Article;

public record RankedArticle(Article article, double score) {
}
