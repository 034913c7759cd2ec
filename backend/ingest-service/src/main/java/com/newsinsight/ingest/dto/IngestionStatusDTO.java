package com.newsinsight.ingest.dto;

import com.newsinsight.ingest.scheduler.ScheduledJob;
import com.newsinsight.ingest.service.resilience.SourceHealthRegistry.SourceHealthSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record IngestionStatusDTO(
        boolean schedulerEnabled,
        long totalArticles,
        long distinctSources,
        long articlesLast24h,
        long totalTopics,
        long activeTopics,
        long activeFeeds,
        List<ScheduledJob> scheduledJobs,
        Instant lastScheduleRefresh,
        String lastScheduleError,
        Instant lastScheduleErrorAt,
        Map<String, SourceHealthSnapshot> sources,
        Map<String, IngestionResult> lastRuns
) {}
