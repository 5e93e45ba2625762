package com.mobifone.broker.service.assignment;

import com.mobifone.broker.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.FieldDefaults;

import java.util.Objects;

/**
 * Outcome of a resolution: the value, a retryable not-ready signal, or a terminal error.
 * Expected outcomes travel through this type instead of exceptions.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public final class ResolveResult<T> {
    public enum Status { READY, NOT_READY, ERROR }

    Status status;
    T value;
    NotReadyReason reason;
    ErrorCode errorCode;

    public static <T> ResolveResult<T> ready(T value) {
        return new ResolveResult<>(Status.READY, Objects.requireNonNull(value), null, null);
    }

    public static <T> ResolveResult<T> notReady(NotReadyReason reason) {
        return new ResolveResult<>(Status.NOT_READY, null, Objects.requireNonNull(reason), null);
    }

    public static <T> ResolveResult<T> error(ErrorCode errorCode) {
        return new ResolveResult<>(Status.ERROR, null, null, Objects.requireNonNull(errorCode));
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    public boolean isNotReady() {
        return status == Status.NOT_READY;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /** Re-types a NOT_READY or ERROR outcome. */
    @SuppressWarnings("unchecked")
    public <R> ResolveResult<R> failure() {
        if (isReady()) {
            throw new IllegalStateException("READY result has no failure to carry");
        }
        return (ResolveResult<R>) this;
    }

    @Override
    public String toString() {
        switch (status) {
            case READY:
                return "Ready";
            case NOT_READY:
                return "NotReady(" + reason + ")";
            default:
                return "Error(" + errorCode + ")";
        }
    }
}
