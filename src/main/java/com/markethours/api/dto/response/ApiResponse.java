package com.markethours.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/** Success envelope for market-hours responses, stamped with the service clock. */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant respondedAt;

    private ApiResponse(T data, Instant respondedAt) {
        this.data = data;
        this.respondedAt = respondedAt;
    }

    public static <T> ApiResponse<T> of(T data, Instant respondedAt) {
        return new ApiResponse<>(data, respondedAt);
    }
}
