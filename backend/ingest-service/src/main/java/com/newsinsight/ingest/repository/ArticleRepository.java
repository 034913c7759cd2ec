package com.newsinsight.ingest.repository;

import com.newsinsight.ingest.entity.Article;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    Optional<Article> findByUrl(String url);

    boolean existsByUrl(String url);

    List<Article> findByCollectedAtGreaterThanEqualOrderByIdAsc(Instant since);

    long countByCollectedAtGreaterThanEqual(Instant since);

    @Query("SELECT COUNT(DISTINCT a.source) FROM Article a")
    long countDistinctSources();

    /**
     * Case-insensitive substring match on title or body, published since the cutoff.
     * {@code text} must already be escaped with {@code '!'} (see {@code PostgresArticleStore#likeLiteral}).
     */
    @Query("SELECT a FROM Article a " +
           "WHERE a.publishedAt >= :since " +
           "AND (LOWER(a.title) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!' " +
           "  OR LOWER(a.body) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!') " +
           "ORDER BY a.id ASC")
    List<Article> searchCandidates(@Param("text") String text,
                                   @Param("since") Instant since);

    @Query("SELECT a FROM Article a " +
           "WHERE a.publishedAt >= :since " +
           "AND a.source IN :sources " +
           "AND (LOWER(a.title) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!' " +
           "  OR LOWER(a.body) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!') " +
           "ORDER BY a.id ASC")
    List<Article> searchCandidatesInSources(@Param("text") String text,
                                            @Param("since") Instant since,
                                            @Param("sources") Collection<String> sources);

    @Query("SELECT a FROM Article a WHERE a.publishedAt >= :since ORDER BY a.id ASC")
    List<Article> findPublishedSince(@Param("since") Instant since);
}
