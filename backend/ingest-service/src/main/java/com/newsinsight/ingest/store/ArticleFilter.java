package com.newsinsight.ingest.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * 기사 조회 조건. null 필드는 조건에서 제외된다.
 */
@Value
@Builder
public class ArticleFilter {

    /** Case-insensitive substring of title or body */
    String text;

    /** published_at >= publishedSince */
    Instant publishedSince;

    /** collected_at >= collectedSince */
    Instant collectedSince;

    /** Restrict to these sources; null or empty means all */
    Set<String> sources;

    public static ArticleFilter collectedSince(Instant since) {
        return ArticleFilter.builder().collectedSince(since).build();
    }

    public boolean hasSources() {
        return sources != null && !sources.isEmpty();
    }
}
