package com.markethours.api.dto.response;

import com.markethours.domain.enums.BoundaryDirection;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BoundaryResponse {

    private final BoundaryDirection direction;
    private final Instant from;
    private final Instant boundary;
    private final String exchangeTime;
    private final long secondsUntil;
}
