package com.newsinsight.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings for the ingestion pipeline.
 *
 * All groups bind under the {@code ingest} prefix, e.g.
 * {@code ingest.dedup.similarity-threshold=0.85}.
 */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestProperties {

    private Scheduler scheduler = new Scheduler();

    private Resilience resilience = new Resilience();

    private Dedup dedup = new Dedup();

    private Normalizer normalizer = new Normalizer();

    private Search search = new Search();

    private Seed seed = new Seed();

    @Data
    public static class Scheduler {
        /** Master switch for topic scheduling */
        private boolean enabled = true;

        /** Fixed size of the pipeline worker pool */
        private int workerPoolSize = 8;

        /** Pending pipelines allowed beyond the running ones */
        private int queueCapacity = 200;

        /** Window across which (topic, source) start times are spread */
        private Duration staggerWindow = Duration.ofMinutes(10);

        /** Topics with a priority number above this value skip heavyweight sources */
        private int lowPriorityThreshold = 5;

        /** Frequency used when a topic does not define its own */
        private Duration defaultFrequency = Duration.ofHours(1);

        /** Periodic full recomputation of the job set */
        private long refreshIntervalMs = 3_600_000L;
    }

    @Data
    public static class Resilience {
        /** Total attempts per adapter call, first attempt included */
        private int maxAttempts = 3;

        /** Base of the exponential backoff: delay before attempt k is base * 2^k */
        private Duration baseDelay = Duration.ofSeconds(1);

        /** Size of one jitter unit; jitter is uniform in [0, 1) units */
        private Duration jitterUnit = Duration.ofSeconds(1);

        /** Consecutive failures that open a source's circuit */
        private int failureThreshold = 5;

        /** Time an open circuit waits before admitting a probe call */
        private Duration coolDown = Duration.ofMinutes(5);

        /** Hard deadline for a single adapter call */
        private Duration callTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Dedup {
        /** Titles scoring strictly above this ratio are treated as duplicates */
        private double similarityThreshold = 0.85;

        /** How far back (by ingestion time) titles are compared */
        private Duration window = Duration.ofHours(24);
    }

    @Data
    public static class Normalizer {
        private int keywordLimit = 10;

        private int minKeywordLength = 4;

        private List<String> stopwords = new ArrayList<>(List.of(
                "that", "this", "with", "from", "have", "will", "were", "been",
                "their", "they", "them", "then", "than", "what", "when", "where",
                "which", "while", "would", "could", "should", "about", "after",
                "before", "into", "over", "under", "more", "most", "some", "such",
                "only", "other", "also", "just", "said", "says", "your", "there"));

        /** Records whose body contains one of these phrases are dropped */
        private List<String> blockedBodyPhrases = new ArrayList<>(List.of(
                "Connecting decision makers to a dynamic network of information, people and ideas"));
    }

    @Data
    public static class Search {
        private Duration defaultMaxAge = Duration.ofDays(7);

        private int defaultLimit = 20;

        private int maxLimit = 200;
    }

    @Data
    public static class Seed {
        /** Seed the default topic catalogue when the topic table is empty */
        private boolean topicsEnabled = true;

        /** Seed the default RSS feeds when the feed table is empty */
        private boolean feedsEnabled = true;

        /** Sources assigned to seeded topics */
        private List<String> defaultTopicSources = new ArrayList<>(List.of("gnews", "rss"));
    }
}
