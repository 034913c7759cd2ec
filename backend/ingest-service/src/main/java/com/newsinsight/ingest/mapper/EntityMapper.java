package com.newsinsight.ingest.mapper;

import com.newsinsight.ingest.dto.ArticleDTO;
import com.newsinsight.ingest.dto.FeedSourceCreateRequest;
import com.newsinsight.ingest.dto.FeedSourceDTO;
import com.newsinsight.ingest.dto.SearchResultDTO;
import com.newsinsight.ingest.dto.TopicCreateRequest;
import com.newsinsight.ingest.dto.TopicDTO;
import com.newsinsight.ingest.entity.Article;
import com.newsinsight.ingest.entity.FeedSource;
import com.newsinsight.ingest.entity.Topic;
import com.newsinsight.ingest.service.search.RankedArticle;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

@Component
public class EntityMapper {

    public TopicDTO toDTO(Topic topic) {
        return new TopicDTO(
                topic.getId(),
                topic.getQuery(),
                topic.getCategory(),
                topic.getPriority(),
                topic.getIsActive(),
                topic.getSources(),
                topic.getUpdateFrequencySeconds(),
                topic.getCreatedAt(),
                topic.getUpdatedAt()
        );
    }

    public Topic toEntity(TopicCreateRequest request, Set<String> sources) {
        return Topic.builder()
                .query(request.query().trim())
                .category(request.category())
                .priority(request.priority())
                .isActive(request.active())
                .sources(new LinkedHashSet<>(sources))
                .updateFrequencySeconds(request.updateFrequencySeconds())
                .build();
    }

    public ArticleDTO toDTO(Article article) {
        return new ArticleDTO(
                article.getId(),
                article.getUrl(),
                article.getTitle(),
                article.getBody(),
                article.getPublishedAt(),
                article.getSource(),
                article.getSearchKey(),
                article.getImageUrl(),
                article.getKeywords(),
                article.getCollectedAt(),
                article.getUpdatedAt()
        );
    }

    public SearchResultDTO toDTO(RankedArticle ranked) {
        return new SearchResultDTO(toDTO(ranked.article()), ranked.score());
    }

    public FeedSourceDTO toDTO(FeedSource feed) {
        return new FeedSourceDTO(
                feed.getId(),
                feed.getName(),
                feed.getSite(),
                feed.getUrl(),
                feed.getCategory(),
                feed.getIsActive(),
                feed.getLastCollected(),
                feed.getCreatedAt()
        );
    }

    public FeedSource toEntity(FeedSourceCreateRequest request) {
        return FeedSource.builder()
                .name(request.name())
                .site(request.site())
                .url(request.url().trim())
                .category(request.category())
                .isActive(request.active())
                .build();
    }
}
