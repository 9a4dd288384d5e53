package com.markethours.domain.model;

import com.markethours.domain.enums.MarketEventType;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** The next session transition after a reference instant. */
@Value
@Builder
public class MarketEvent {

    MarketEventType type;
    Instant at;
    long secondsUntil;

    /** Exchange-local date of the session the event belongs to. */
    LocalDate sessionDate;

    boolean earlyClose;
    String notes;
}
