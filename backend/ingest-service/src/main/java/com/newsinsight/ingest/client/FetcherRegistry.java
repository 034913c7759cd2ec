package com.newsinsight.ingest.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 소스 ID → 어댑터 매핑. 기동 시 한 번 구성된다.
 */
@Component
@Slf4j
public class FetcherRegistry {

    private final Map<String, ArticleFetcher> fetchers;

    public FetcherRegistry(List<ArticleFetcher> fetcherBeans) {
        Map<String, ArticleFetcher> map = new TreeMap<>();
        for (ArticleFetcher fetcher : fetcherBeans) {
            ArticleFetcher previous = map.put(fetcher.sourceId(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate fetcher for source '" + fetcher.sourceId() + "': "
                        + previous.getClass().getSimpleName() + " and " + fetcher.getClass().getSimpleName());
            }
        }
        this.fetchers = Collections.unmodifiableMap(map);
        log.info("Registered fetchers: {}", fetchers.keySet());
    }

    public Optional<ArticleFetcher> find(String sourceId) {
        return Optional.ofNullable(fetchers.get(sourceId));
    }

    public boolean contains(String sourceId) {
        return fetchers.containsKey(sourceId);
    }

    public boolean isHeavyweight(String sourceId) {
        ArticleFetcher fetcher = fetchers.get(sourceId);
        return fetcher != null && fetcher.isHeavyweight();
    }

    public Set<String> sourceIds() {
        return fetchers.keySet();
    }
}
