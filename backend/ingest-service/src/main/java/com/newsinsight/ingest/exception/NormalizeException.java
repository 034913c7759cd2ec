package com.newsinsight.ingest.exception;

/**
 * 원시 레코드를 기사로 정규화할 수 없는 경우. 해당 레코드만 버려진다.
 */
public class NormalizeException extends IngestException {

    public enum Reason {
        MISSING_REQUIRED_FIELD,
        BLOCKED_CONTENT
    }

    private final Reason reason;

    public NormalizeException(Reason reason, String message) {
        super("NORMALIZE_" + reason.name(), message);
        this.reason = reason;
    }

    public static NormalizeException missingField(String field, String sourceId) {
        return new NormalizeException(Reason.MISSING_REQUIRED_FIELD,
                "Missing required field '" + field + "' in record from " + sourceId);
    }

    public Reason getReason() {
        return reason;
    }
}
