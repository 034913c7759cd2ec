package com.newsinsight.ingest.dto;

import com.newsinsight.ingest.exception.FetchException;

import java.time.Instant;

/**
 * (토픽, 소스) 파이프라인 1회 실행 결과
 */
public record IngestionResult(
        String topicQuery,
        String sourceId,
        Instant startedAt,
        Instant finishedAt,
        int fetched,
        int dropped,
        int inserted,
        int updated,
        int suppressed,
        int storeFailures,
        FetchException.Type fetchError,
        String errorMessage
) {
    public boolean isSuccess() {
        return fetchError == null && errorMessage == null;
    }

    public static IngestionResult failed(String topicQuery, String sourceId, Instant startedAt, Instant finishedAt,
                                         FetchException.Type fetchError, String errorMessage) {
        return new IngestionResult(topicQuery, sourceId, startedAt, finishedAt,
                0, 0, 0, 0, 0, 0, fetchError, errorMessage);
    }
}
