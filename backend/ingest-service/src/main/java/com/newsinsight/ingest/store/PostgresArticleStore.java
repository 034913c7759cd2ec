package com.newsinsight.ingest.store;

import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.entity.KeywordListConverter;
import com.newsinsight.ingest.exception.StoreException;
import com.newsinsight.ingest.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * PostgreSQL 기반 기사 저장소.
 * URL 단위 원자성은 INSERT ... ON CONFLICT (url) DO UPDATE 가 보장한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostgresArticleStore implements ArticleStore {

    private static final String UPSERT_SQL = """
        INSERT INTO articles (url, title, body, published_at, source, search_key, image_url,
                              keywords, collected_at, updated_at)
        VALUES (:url, :title, :body, :publishedAt, :source, :searchKey, :imageUrl,
                :keywords, :now, :now)
        ON CONFLICT (url) DO UPDATE SET
            title = EXCLUDED.title,
            body = EXCLUDED.body,
            published_at = EXCLUDED.published_at,
            source = EXCLUDED.source,
            search_key = EXCLUDED.search_key,
            image_url = EXCLUDED.image_url,
            keywords = EXCLUDED.keywords,
            updated_at = EXCLUDED.updated_at
        RETURNING (xmax = 0) AS inserted
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ArticleRepository articleRepository;
    private final Clock clock;

    private final KeywordListConverter keywordConverter = new KeywordListConverter();

    @Override
    @Transactional
    public UpsertResult upsertByUrl(Article article) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("url", article.getUrl())
                .addValue("title", article.getTitle())
                .addValue("body", article.getBody())
                .addValue("publishedAt", article.getPublishedAt().atOffset(ZoneOffset.UTC))
                .addValue("source", article.getSource())
                .addValue("searchKey", article.getSearchKey())
                .addValue("imageUrl", article.getImageUrl())
                .addValue("keywords", keywordConverter.convertToDatabaseColumn(article.getKeywords()))
                .addValue("now", clock.instant().atOffset(ZoneOffset.UTC));

        Boolean inserted = execute("upsert " + article.getUrl(),
                () -> jdbcTemplate.queryForObject(UPSERT_SQL, params, Boolean.class));
        return Boolean.TRUE.equals(inserted) ? UpsertResult.INSERTED : UpsertResult.UPDATED;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Article> findByUrl(String url) {
        return execute("findByUrl", () -> articleRepository.findByUrl(url));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Article> find(ArticleFilter filter) {
        return execute("find", () -> {
            Stream<Article> candidates;
            if (filter.getText() != null) {
                Instant since = filter.getPublishedSince() != null ? filter.getPublishedSince() : Instant.EPOCH;
                String text = likeLiteral(filter.getText());
                candidates = (filter.hasSources()
                        ? articleRepository.searchCandidatesInSources(text, since, filter.getSources())
                        : articleRepository.searchCandidates(text, since)).stream();
            } else if (filter.getCollectedSince() != null) {
                candidates = articleRepository
                        .findByCollectedAtGreaterThanEqualOrderByIdAsc(filter.getCollectedSince()).stream();
            } else if (filter.getPublishedSince() != null) {
                candidates = articleRepository.findPublishedSince(filter.getPublishedSince()).stream();
            } else {
                candidates = articleRepository.findAll(Sort.by(Sort.Direction.ASC, "id")).stream();
            }

            // 쿼리에 반영되지 않은 나머지 조건
            return candidates
                    .filter(a -> filter.getCollectedSince() == null
                            || !a.getCollectedAt().isBefore(filter.getCollectedSince()))
                    .filter(a -> filter.getPublishedSince() == null
                            || !a.getPublishedAt().isBefore(filter.getPublishedSince()))
                    .filter(a -> !filter.hasSources() || filter.getSources().contains(a.getSource()))
                    .toList();
        });
    }

    /**
     * LIKE 패턴 안에서 검색어가 문자 그대로 비교되도록 '!', '%', '_' 를 이스케이프한다.
     */
    static String likeLiteral(String text) {
        return text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    @Override
    @Transactional(readOnly = true)
    public long countRecent(Duration window) {
        Instant since = clock.instant().minus(window);
        return execute("countRecent", () -> articleRepository.countByCollectedAtGreaterThanEqual(since));
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return execute("count", articleRepository::count);
    }

    @Override
    @Transactional(readOnly = true)
    public long countDistinctSources() {
        return execute("countDistinctSources", articleRepository::countDistinctSources);
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            log.warn("Article store conflict during {}: {}", operation, e.getMessage());
            throw new StoreException(StoreException.Kind.CONFLICT, "Store conflict during " + operation, e);
        } catch (DataAccessException e) {
            log.error("Article store unavailable during {}: {}", operation, e.getMessage());
            throw new StoreException(StoreException.Kind.UNAVAILABLE, "Store unavailable during " + operation, e);
        }
    }
}
