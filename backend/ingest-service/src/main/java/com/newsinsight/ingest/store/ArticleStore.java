package com.newsinsight.ingest.store;

import com.newsinsight.ingest.entity.Article;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Persistent article storage.
 *
 * Implementations must make {@link #upsertByUrl(Article)} atomic per URL: concurrent
 * callers for the same URL leave exactly one record holding one caller's fields.
 * Results of {@link #find(ArticleFilter)} are in insertion order.
 */
public interface ArticleStore {

    /**
     * Insert the article or overwrite the record with the same URL.
     *
     * @return {@link UpsertResult#INSERTED} or {@link UpsertResult#UPDATED}
     * @throws com.newsinsight.ingest.exception.StoreException when the store rejects the write
     */
    UpsertResult upsertByUrl(Article article);

    Optional<Article> findByUrl(String url);

    List<Article> find(ArticleFilter filter);

    /**
     * Articles first ingested within the given window.
     */
    long countRecent(Duration window);

    long count();

    long countDistinctSources();
}
