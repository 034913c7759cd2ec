package com.newsinsight.ingest.client;

import com.newsinsight.ingest.entity.FeedSource;
import com.newsinsight.ingest.exception.FetchException;
import com.newsinsight.ingest.repository.FeedSourceRepository;
import com.rometools.rome.feed.synd.SyndEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 등록된 RSS 피드 어댑터 (소스 ID: rss).
 * 활성 피드를 모두 읽고 토픽 질의어를 포함한 엔트리만 돌려준다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RssFeedFetcher implements ArticleFetcher {

    public static final String SOURCE_ID = "rss";

    private final WebClient webClient;
    private final FeedSourceRepository feedSourceRepository;

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public List<RawArticle> fetch(String topicQuery, Duration deadline) throws FetchException {
        List<FeedSource> feeds = feedSourceRepository.findByIsActiveTrue();
        if (feeds.isEmpty()) {
            log.debug("No active RSS feeds registered");
            return List.of();
        }

        Instant deadlineAt = Instant.now().plus(deadline);
        List<RawArticle> results = new ArrayList<>();
        RuntimeException lastFailure = null;
        int failedFeeds = 0;

        for (FeedSource feed : feeds) {
            Duration remaining = Duration.between(Instant.now(), deadlineAt);
            if (remaining.isNegative() || remaining.isZero()) {
                log.warn("Deadline reached after {} of {} feeds for '{}'", feeds.indexOf(feed), feeds.size(), topicQuery);
                break;
            }
            try {
                results.addAll(readFeed(feed, topicQuery, remaining));
                feed.setLastCollected(LocalDateTime.now());
                feedSourceRepository.save(feed);
            } catch (RuntimeException e) {
                // 피드 하나의 실패는 나머지 피드 수집을 막지 않는다
                failedFeeds++;
                lastFailure = e;
                log.warn("Error fetching RSS feed {} ({}): {}", feed.getName(), feed.getUrl(), e.getMessage());
            }
        }

        if (lastFailure != null && failedFeeds == feeds.size()) {
            throw lastFailure;
        }
        log.info("Found {} entries mentioning '{}' across {} feeds", results.size(), topicQuery, feeds.size());
        return results;
    }

    private List<RawArticle> readFeed(FeedSource feed, String topicQuery, Duration timeout) {
        String xml = webClient.get()
                .uri(feed.getUrl())
                .header("Accept", "application/rss+xml, application/xml, text/xml, */*")
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
        if (xml == null || xml.isBlank()) {
            throw FetchException.invalidResponse(SOURCE_ID, "Empty feed from " + feed.getUrl(), null);
        }

        List<RawArticle> matches = new ArrayList<>();
        for (SyndEntry entry : FeedEntryParser.parse(xml, SOURCE_ID, feed.getUrl())) {
            if (FeedEntryParser.mentions(entry, topicQuery)) {
                matches.add(FeedEntryParser.toRawArticle(entry, SOURCE_ID, topicQuery, feed.getName()));
            }
        }
        return matches;
    }
}
