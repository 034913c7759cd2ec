package com.newsinsight.ingest.repository;

import com.newsinsight.ingest.entity.FeedSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeedSourceRepository extends JpaRepository<FeedSource, Long> {

    List<FeedSource> findByIsActiveTrue();

    List<FeedSource> findByIsActiveTrueAndCategory(String category);

    Optional<FeedSource> findByUrl(String url);

    List<FeedSource> findByName(String name);

    long countByIsActiveTrue();
}
