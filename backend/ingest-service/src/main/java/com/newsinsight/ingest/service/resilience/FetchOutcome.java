package com.newsinsight.ingest.service.resilience;

import com.newsinsight.ingest.exception.FetchException;

import java.util.Objects;
import java.util.Optional;

/**
 * 보호된 어댑터 호출 결과. 성공 값 또는 {@link FetchException} 중 하나만 가진다.
 */
public final class FetchOutcome<T> {

    private final T value;
    private final FetchException error;

    private FetchOutcome(T value, FetchException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchOutcome<T> success(T value) {
        return new FetchOutcome<>(value, null);
    }

    public static <T> FetchOutcome<T> failure(FetchException error) {
        return new FetchOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error.getType(), error);
        }
        return value;
    }

    public Optional<FetchException> error() {
        return Optional.ofNullable(error);
    }

    public Optional<FetchException.Type> errorType() {
        return error().map(FetchException::getType);
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchOutcome[success]" : "FetchOutcome[" + error.getType() + ": " + error.getMessage() + "]";
    }
}
