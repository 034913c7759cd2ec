package com.newsinsight.ingest.service.search;

import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.store.ArticleFilter;
import com.newsinsight.ingest.store.ArticleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 최신성/키워드 복합 점수 검색.
 *
 * score = 5 * recency + 3 * titleMatches + 0.2 * bodyMatches
 * recency = 1 - min(ageDays / maxAgeDays, 1)
 *
 * 정렬: 점수 내림차순, 게시 시각 최신순, 저장 순서(id) 오름차순.
 * 검색어는 공백을 포함해 입력 그대로 비교한다. 매 호출마다 현재 데이터로 다시 계산한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleSearchService {

    static final double RECENCY_WEIGHT = 5.0;
    static final double TITLE_WEIGHT = 3.0;
    static final double BODY_WEIGHT = 0.2;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private static final Comparator<RankedArticle> RANKING = Comparator
            .comparingDouble(RankedArticle::score).reversed()
            .thenComparing((RankedArticle r) -> r.article().getPublishedAt(), Comparator.reverseOrder())
            .thenComparing((RankedArticle r) -> r.article().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final ArticleStore articleStore;
    private final Clock clock;

    public List<Article> search(String query, Duration maxAge, Set<String> allowedSources) {
        return rank(query, maxAge, allowedSources, null).stream()
                .map(RankedArticle::article)
                .toList();
    }

    /**
     * @param limit maximum results, or null for all
     */
    public List<RankedArticle> rank(String query, Duration maxAge, Set<String> allowedSources, Integer limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Instant now = clock.instant();

        List<Article> candidates = articleStore.find(ArticleFilter.builder()
                .text(query)
                .publishedSince(now.minus(maxAge))
                .sources(allowedSources)
                .build());

        List<RankedArticle> ranked = candidates.stream()
                .filter(article -> contains(article, query))
                .map(article -> new RankedArticle(article, score(article, query, maxAge, now)))
                .sorted(RANKING)
                .limit(limit == null ? Long.MAX_VALUE : Math.max(0, limit))
                .toList();
        log.debug("Search '{}' (maxAge={}, sources={}): {} candidates", query, maxAge, allowedSources, candidates.size());
        return ranked;
    }

    static double score(Article article, String query, Duration maxAge, Instant now) {
        return RECENCY_WEIGHT * recency(article.getPublishedAt(), maxAge, now)
                + TITLE_WEIGHT * countOccurrences(article.getTitle(), query)
                + BODY_WEIGHT * countOccurrences(article.getBody(), query);
    }

    private static boolean contains(Article article, String query) {
        return countOccurrences(article.getTitle(), query) > 0 || countOccurrences(article.getBody(), query) > 0;
    }

    static double recency(Instant publishedAt, Duration maxAge, Instant now) {
        double ageDays = Math.max(0, Duration.between(publishedAt, now).toMillis()) / MILLIS_PER_DAY;
        double maxAgeDays = maxAge.toMillis() / MILLIS_PER_DAY;
        if (maxAgeDays <= 0) {
            return ageDays <= 0 ? 1.0 : 0.0;
        }
        return 1.0 - Math.min(ageDays / maxAgeDays, 1.0);
    }

    /**
     * Non-overlapping, case-insensitive occurrences.
     */
    static int countOccurrences(String text, String query) {
        if (text == null || query.isEmpty()) {
            return 0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        String needle = query.toLowerCase(Locale.ROOT);
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
