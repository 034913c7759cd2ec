package com.newsinsight.ingest.client;

import com.newsinsight.ingest.exception.FetchException;

import java.time.Duration;
import java.util.List;

/**
 * 소스 어댑터. 소스 하나당 빈 하나이며 {@link FetcherRegistry}가 소스 ID로 찾는다.
 *
 * 구현체는 응답을 해석할 수 없으면 {@link FetchException.Type#INVALID_RESPONSE}를,
 * 일시적인 네트워크 오류는 원래 예외를 던진다. 재시도와 회로 차단은 호출하는 쪽의 몫이다.
 */
public interface ArticleFetcher {

    String sourceId();

    /**
     * Heavyweight sources (full page scraping) are skipped for low-priority topics.
     */
    default boolean isHeavyweight() {
        return false;
    }

    List<RawArticle> fetch(String topicQuery, Duration deadline) throws FetchException;
}
