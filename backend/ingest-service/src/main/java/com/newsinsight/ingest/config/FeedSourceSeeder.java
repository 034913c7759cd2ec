package com.newsinsight.ingest.config;

import com.newsinsight.ingest.entity.FeedSource;
import com.newsinsight.ingest.service.FeedSourceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * feed_sources 테이블이 비어 있으면 기본 금융/정치 RSS 피드를 넣는다.
 */
@Component
@Profile("!no-seed")
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class FeedSourceSeeder implements ApplicationRunner {

    private final FeedSourceService feedSourceService;
    private final IngestProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isFeedsEnabled()) {
            log.info("Feed source seeding is disabled via configuration.");
            return;
        }
        feedSourceService.initializeDefaults(createDefaultFeeds());
    }

    static List<FeedSource> createDefaultFeeds() {
        return List.of(
                feed("FinancialTimes", "www.ft.com", "https://www.ft.com/news-feed?format=rss", "finance"),
                feed("WallStreetJournal", "www.wsj.com", "https://feeds.a.dj.com/rss/RSSMarketsMain.xml", "finance"),
                feed("Bloomberg", "www.bloomberg.com", "https://feeds.bloomberg.com/markets/news.rss", "finance"),
                feed("YahooFinance", "finance.yahoo.com", "https://finance.yahoo.com/news/rssindex", "finance"),
                feed("MarketWatch", "www.marketwatch.com", "https://feeds.marketwatch.com/marketwatch/topstories/", "finance"),
                feed("ZeroHedge", "www.zerohedge.com", "https://feeds.feedburner.com/zerohedge/feed", "finance"),
                feed("Politico", "www.politico.com", "https://rss.politico.com/economy.xml", "politics"),
                feed("Politico", "www.politico.com", "https://rss.politico.com/politics-news.xml", "politics"),
                feed("PoliticoEurope", "www.politico.eu", "https://www.politico.eu/rss", "politics"),
                feed("Nasdaq Latest Articles", "www.nasdaq.com",
                        "https://nasdaqtrader.com/rss.aspx?feed=currentheadlines&categorylist=0", "finance")
        );
    }

    private static FeedSource feed(String name, String site, String url, String category) {
        return FeedSource.builder()
                .name(name)
                .site(site)
                .url(url)
                .category(category)
                .isActive(true)
                .build();
    }
}
