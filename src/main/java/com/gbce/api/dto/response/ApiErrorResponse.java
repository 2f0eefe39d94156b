package com.gbce.api.dto.response;

import com.gbce.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope rendered by {@link com.gbce.exception.GlobalExceptionHandler}.
 *
 * <p>{@code details} carries the offending input, such as the {@code symbol} of an unknown
 * or duplicate stock or the {@code quantity} of a rejected trade.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
