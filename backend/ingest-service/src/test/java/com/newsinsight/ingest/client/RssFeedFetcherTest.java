package com.newsinsight.ingest.client;

import com.newsinsight.ingest.entity.FeedSource;
import com.newsinsight.ingest.repository.FeedSourceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssFeedFetcherTest {

    @Mock
    private FeedSourceRepository feedSourceRepository;

    /** /broken 경로는 503, 나머지는 테스트 RSS 문서 */
    private final WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                if (request.url().getPath().endsWith("/broken")) {
                    return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
                }
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_XML_VALUE)
                        .body(FeedEntryParserTest.RSS)
                        .build());
            })
            .build();

    private static FeedSource feed(String name, String url) {
        return FeedSource.builder().name(name).url(url).build();
    }

    @Test
    @DisplayName("활성 피드에서 질의어를 언급한 엔트리만 모은다")
    void collectsMatchingEntries() {
        FeedSource markets = feed("Markets", "https://feeds.example.com/markets");
        when(feedSourceRepository.findByIsActiveTrue()).thenReturn(List.of(markets));

        List<RawArticle> records = new RssFeedFetcher(webClient, feedSourceRepository).fetch("gold", Duration.ofSeconds(5));

        assertThat(records).extracting(r -> r.get("link")).containsExactly("https://example.com/gold");
        assertThat(records.get(0).get("publisher")).isEqualTo("Markets");
        assertThat(markets.getLastCollected()).isNotNull();
        verify(feedSourceRepository).save(markets);
    }

    @Test
    @DisplayName("일부 피드 실패는 나머지 결과를 막지 않는다")
    void toleratesPartialFailure() {
        FeedSource broken = feed("Broken", "https://feeds.example.com/broken");
        when(feedSourceRepository.findByIsActiveTrue())
                .thenReturn(List.of(broken, feed("Markets", "https://feeds.example.com/markets")));

        List<RawArticle> records = new RssFeedFetcher(webClient, feedSourceRepository).fetch("oil", Duration.ofSeconds(5));

        assertThat(records).hasSize(1);
        verify(feedSourceRepository, never()).save(broken);
    }

    @Test
    @DisplayName("모든 피드가 실패하면 예외를 던진다")
    void failsWhenEveryFeedFails() {
        when(feedSourceRepository.findByIsActiveTrue())
                .thenReturn(List.of(feed("Broken", "https://feeds.example.com/broken")));

        assertThatThrownBy(() -> new RssFeedFetcher(webClient, feedSourceRepository).fetch("oil", Duration.ofSeconds(5)))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("활성 피드가 없으면 빈 결과")
    void noFeeds() {
        when(feedSourceRepository.findByIsActiveTrue()).thenReturn(List.of());

        assertThat(new RssFeedFetcher(webClient, feedSourceRepository).fetch("oil", Duration.ofSeconds(5))).isEmpty();
    }
}
