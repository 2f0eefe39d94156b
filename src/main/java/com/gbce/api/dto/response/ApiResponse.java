package com.gbce.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for the exchange REST API: {@code {success: true, data, timestamp}}.
 *
 * <p>Controllers return bare DTOs; {@link com.gbce.config.ApiResponseAdvice} wraps them.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
