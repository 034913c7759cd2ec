package com.newsinsight.ingest.exception;

/**
 * 외부 소스 호출 실패.
 * 어댑터는 응답을 해석할 수 없을 때 INVALID_RESPONSE를, 나머지 실패는 원인 예외를 그대로 던진다.
 */
public class FetchException extends IngestException {

    public enum Type {
        TIMEOUT,
        EXHAUSTED,
        CIRCUIT_OPEN,
        INVALID_RESPONSE
    }

    private final Type type;
    private final String sourceId;

    public FetchException(Type type, String sourceId, String message) {
        super("FETCH_" + type.name(), message);
        this.type = type;
        this.sourceId = sourceId;
    }

    public FetchException(Type type, String sourceId, String message, Throwable cause) {
        super("FETCH_" + type.name(), message, cause);
        this.type = type;
        this.sourceId = sourceId;
    }

    public static FetchException invalidResponse(String sourceId, String message, Throwable cause) {
        return new FetchException(Type.INVALID_RESPONSE, sourceId, message, cause);
    }

    public Type getType() {
        return type;
    }

    public String getSourceId() {
        return sourceId;
    }
}
