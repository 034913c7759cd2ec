package com.newsinsight.ingest.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * (토픽, 소스) 주기 작업.
 *
 * @param initialOffset stagger offset from the planning instant; {@code nextRunAt = plannedAt + initialOffset}
 */
public record ScheduledJob(
        String topicQuery,
        String source,
        Instant nextRunAt,
        Duration interval,
        Duration initialOffset
) {

    public static String keyOf(String topicQuery, String source) {
        return topicQuery + "|" + source;
    }

    public String key() {
        return keyOf(topicQuery, source);
    }

    /**
     * Same pair with the same repeat interval; such a job keeps its running timer on recomputation.
     */
    public boolean sameScheduleAs(ScheduledJob other) {
        return other != null && key().equals(other.key()) && interval.equals(other.interval);
    }

    public ScheduledJob withNextRunAt(Instant next) {
        return new ScheduledJob(topicQuery, source, next, interval, initialOffset);
    }
}
