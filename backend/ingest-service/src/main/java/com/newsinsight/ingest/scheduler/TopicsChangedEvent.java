package com.newsinsight.ingest.scheduler;

/**
 * 토픽 집합 변경 알림. 커밋 후 스케줄러가 작업 집합을 다시 계산한다.
 */
public record TopicsChangedEvent(String query, Change change) {

    public enum Change {
        ADDED,
        REMOVED,
        TOGGLED,
        UPDATED,
        SEEDED
    }
}
