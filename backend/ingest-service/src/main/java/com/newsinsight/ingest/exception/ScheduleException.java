package com.newsinsight.ingest.exception;

/**
 * 작업 스케줄 재계산 실패. 직전 작업 집합은 그대로 유지된다.
 */
public class ScheduleException extends IngestException {

    public ScheduleException(String message, Throwable cause) {
        super("SCHEDULE_RECOMPUTE_FAILED", message, cause);
    }
}
