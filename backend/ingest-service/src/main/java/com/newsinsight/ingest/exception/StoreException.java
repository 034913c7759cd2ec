package com.newsinsight.ingest.exception;

/**
 * 기사 저장소 접근 실패
 */
public class StoreException extends IngestException {

    public enum Kind {
        UNAVAILABLE,
        CONFLICT
    }

    private final Kind kind;

    public StoreException(Kind kind, String message, Throwable cause) {
        super("STORE_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
