package com.newsinsight.ingest.client;

import com.newsinsight.ingest.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 전체 페이지 스크래핑 어댑터 (소스 ID: web, 고비용).
 * Google News 검색 결과의 각 기사 페이지를 받아 본문 텍스트를 채운다.
 */
@Component
@Slf4j
public class WebPageFetcher implements ArticleFetcher {

    public static final String SOURCE_ID = "web";

    private static final int MIN_CONTENT_LENGTH = 100;

    private final GoogleNewsFetcher searchFetcher;
    private final WebClient webClient;
    private final int maxPages;

    public WebPageFetcher(GoogleNewsFetcher searchFetcher,
                          WebClient webClient,
                          @Value("${ingest.sources.web.max-pages:10}") int maxPages) {
        this.searchFetcher = searchFetcher;
        this.webClient = webClient;
        this.maxPages = maxPages;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public boolean isHeavyweight() {
        return true;
    }

    @Override
    public List<RawArticle> fetch(String topicQuery, Duration deadline) throws FetchException {
        Instant deadlineAt = Instant.now().plus(deadline);
        List<RawArticle> hits = searchFetcher.fetch(topicQuery, deadline);

        List<RawArticle> results = new ArrayList<>();
        for (RawArticle hit : hits.subList(0, Math.min(maxPages, hits.size()))) {
            Duration remaining = Duration.between(Instant.now(), deadlineAt);
            if (remaining.isNegative() || remaining.isZero()) {
                break;
            }
            Map<String, Object> fields = new LinkedHashMap<>(hit.fields());
            String url = String.valueOf(hit.get("link"));
            String content = scrape(url, remaining);
            if (content != null) {
                fields.put("content", content);
            }
            results.add(new RawArticle(SOURCE_ID, fields));
        }
        return results;
    }

    /**
     * 페이지 본문 텍스트. 가져오지 못하거나 너무 짧으면 null (검색 요약으로 대체된다).
     */
    private String scrape(String url, Duration timeout) {
        try {
            String html = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
            if (html == null || html.isBlank()) {
                log.warn("Empty response from: {}", url);
                return null;
            }

            Document doc = Jsoup.parse(html);
            // script/style/nav/footer/aside 제거
            doc.select("script, style, nav, footer, aside").remove();
            String text = doc.body() != null ? FeedEntryParser.normalizeText(doc.body().text()) : "";
            if (text.length() < MIN_CONTENT_LENGTH) {
                log.debug("Skipping page with too short content: {}", url);
                return null;
            }
            return text;
        } catch (RuntimeException e) {
            log.warn("Error scraping web page {}: {}", url, e.getMessage());
            return null;
        }
    }
}
