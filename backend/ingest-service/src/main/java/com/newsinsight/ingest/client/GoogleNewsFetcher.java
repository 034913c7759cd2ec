package com.newsinsight.ingest.client;

import com.newsinsight.ingest.exception.FetchException;
import com.rometools.rome.feed.synd.SyndEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Google News RSS 검색 어댑터 (소스 ID: gnews).
 * 최근 하루 기사만 요청한다.
 */
@Component
@Slf4j
public class GoogleNewsFetcher implements ArticleFetcher {

    public static final String SOURCE_ID = "gnews";

    private final WebClient webClient;
    private final String searchUrl;
    private final String language;
    private final String country;
    private final int maxResults;

    public GoogleNewsFetcher(WebClient webClient,
                             @Value("${ingest.sources.gnews.search-url:https://news.google.com/rss/search}") String searchUrl,
                             @Value("${ingest.sources.gnews.language:en}") String language,
                             @Value("${ingest.sources.gnews.country:US}") String country,
                             @Value("${ingest.sources.gnews.max-results:50}") int maxResults) {
        this.webClient = webClient;
        this.searchUrl = searchUrl;
        this.language = language;
        this.country = country;
        this.maxResults = maxResults;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public List<RawArticle> fetch(String topicQuery, Duration deadline) throws FetchException {
        URI uri = UriComponentsBuilder.fromHttpUrl(searchUrl)
                .queryParam("q", topicQuery + " when:1d")
                .queryParam("hl", language + "-" + country)
                .queryParam("gl", country)
                .queryParam("ceid", country + ":" + language)
                .encode()
                .build()
                .toUri();

        log.debug("Searching Google News: {}", uri);
        String xml = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(String.class)
                .block(deadline);

        if (xml == null || xml.isBlank()) {
            throw FetchException.invalidResponse(SOURCE_ID, "Empty response for query '" + topicQuery + "'", null);
        }

        List<RawArticle> results = new ArrayList<>();
        for (SyndEntry entry : FeedEntryParser.parse(xml, SOURCE_ID, searchUrl)) {
            if (results.size() >= maxResults) {
                break;
            }
            String publisher = entry.getSource() != null ? entry.getSource().getTitle() : null;
            results.add(FeedEntryParser.toRawArticle(entry, SOURCE_ID, topicQuery, publisher));
        }
        log.info("{} result OK! ({} articles)", topicQuery, results.size());
        return results;
    }
}
