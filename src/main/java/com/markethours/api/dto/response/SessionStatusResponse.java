package com.markethours.api.dto.response;

import com.markethours.domain.enums.SessionStatus;
import java.time.Instant;
import java.time.LocalTime;
import lombok.Builder;
import lombok.Getter;

/**
 * Response DTO for GET /api/market-hours/status.
 *
 * <p>{@code exchangeTime} is the classified instant rendered in exchange-local time.
 */
@Getter
@Builder
public class SessionStatusResponse {

    private final Instant at;
    private final String exchangeTime;
    private final SessionStatus status;
    private final boolean open;
    private final String holidayName;
    private final LocalTime closedAt;
}
