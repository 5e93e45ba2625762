package com.mobifone.broker.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mobifone.broker.exception.ErrorCode;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Response shape of every /connection and /client call.
 * <p>
 * {@code retryable} is "1" when the client should poll again rather than treat the
 * response as final; {@code error} is absent on success.
 */
@Getter
@Builder(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultEnvelope {
    Object result;
    String date;
    String error;
    String retryable;

    @JsonIgnore
    ErrorCode errorCode;

    public static ResultEnvelope ok(Object result) {
        return ResultEnvelope.builder()
                .result(result == null ? "" : result)
                .date(now())
                .retryable("0")
                .build();
    }

    public static ResultEnvelope error(ErrorCode errorCode) {
        return failure(errorCode, errorCode.getMessage(), false);
    }

    /** Not-ready response: the stable reason code is appended so the client can pick its message. */
    public static ResultEnvelope retry(ErrorCode errorCode, int reasonCode) {
        return failure(errorCode, withCode(errorCode.getMessage(), reasonCode), true);
    }

    /** Last-resort error carrying a plain message instead of a predefined code. */
    public static ResultEnvelope error(String message) {
        return failure(ErrorCode.UNCATEGORIZED_EXCEPTION, message, false);
    }

    public boolean shouldRetry() {
        return "1".equals(retryable);
    }

    static String withCode(String message, int code) {
        return code == 0 ? message : message + String.format(Locale.ROOT, " (code %04X)", code);
    }

    private static ResultEnvelope failure(ErrorCode errorCode, String message, boolean retryable) {
        return ResultEnvelope.builder()
                .result("")
                .date(now())
                .error(message)
                .retryable(retryable ? "1" : "0")
                .errorCode(errorCode)
                .build();
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
