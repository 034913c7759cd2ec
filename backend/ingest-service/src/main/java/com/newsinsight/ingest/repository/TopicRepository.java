package com.newsinsight.ingest.repository;

import com.newsinsight.ingest.entity.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    Optional<Topic> findByQuery(String query);

    boolean existsByQuery(String query);

    /**
     * Lower priority number first; id keeps creation order among equals.
     */
    List<Topic> findAllByOrderByPriorityAscIdAsc();

    List<Topic> findByIsActiveTrueOrderByPriorityAscIdAsc();

    List<Topic> findByCategoryOrderByPriorityAscIdAsc(String category);

    List<Topic> findByCategoryAndIsActiveTrueOrderByPriorityAscIdAsc(String category);

    long countByIsActiveTrue();
}
