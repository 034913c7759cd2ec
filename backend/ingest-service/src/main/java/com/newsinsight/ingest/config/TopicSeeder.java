package com.newsinsight.ingest.config;

import com.newsinsight.ingest.service.TopicService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 토픽 테이블이 비어 있으면 기본 토픽 카탈로그를 넣는다.
 *
 * Profiles:
 * - default: Runs automatically
 * - no-seed: Skip seeding
 */
@Component
@Profile("!no-seed")
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class TopicSeeder implements ApplicationRunner {

    static final Map<String, List<String>> DEFAULT_TOPICS = defaultTopics();

    private final TopicService topicService;
    private final IngestProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isTopicsEnabled()) {
            log.info("Topic seeding is disabled via configuration.");
            return;
        }
        int created = topicService.initializeDefaults(DEFAULT_TOPICS);
        log.info("Topic seeding completed: created={}", created);
    }

    private static Map<String, List<String>> defaultTopics() {
        Map<String, List<String>> topics = new LinkedHashMap<>();
        topics.put("markets", List.of(
                "Stock Market", "Bonds", "Futures", "Bond Market",
                "S&P500", "Nasdaq composite index", "DAX", "FTSE", "CAC",
                "BTP", "BUND", "Nikkei", "TBond", "BONOS", "Treasury", "OAT"));
        topics.put("economy", List.of(
                "Macroeconomic", "Fiscal Policy", "Monetary Policy",
                "FED", "ECB", "BOJ", "BoE", "Unemployment", "Inflation",
                "Economic Calendar", "Wages", "Consumer Confidence",
                "Powell", "Lagarde", "Economy", "Earnings"));
        topics.put("geopolitics", List.of(
                "Trump", "Russia", "Putin", "China", "Xijinping", "Iran", "Israel"));
        topics.put("commodities", List.of(
                "OIL", "WTI", "Brent", "Silver", "Copper", "Gold", "Commodities"));
        topics.put("currencies", List.of(
                "Exchange Rates", "Currencies", "USD", "EUR", "YEN", "Dollar",
                "CHF", "GBP", "CNY", "AUD", "JPY", "NZD"));
        return topics;
    }
}
