package com.newsinsight.ingest.exception;

/**
 * 수집 파이프라인 관련 예외 기본 클래스
 */
public class IngestException extends RuntimeException {

    private final String errorCode;

    public IngestException(String message) {
        super(message);
        this.errorCode = "INGEST_ERROR";
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "INGEST_ERROR";
    }

    public IngestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IngestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
