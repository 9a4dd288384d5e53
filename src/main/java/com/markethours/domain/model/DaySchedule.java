package com.markethours.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Session boundaries for one exchange-local date. {@code openAt}/{@code closeAt} are null
 * when the market does not trade that day.
 */
@Value
@Builder
public class DaySchedule {

    LocalDate date;
    boolean tradingDay;
    Instant openAt;
    Instant closeAt;
    boolean earlyClose;
    String holidayName;
    String notes;
}
