package com.markethours.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import lombok.Builder;
import lombok.Value;

/** Exchange-local closing time for a shortened session. */
@Value
@Builder
public class EarlyCloseOverride {

    LocalDate date;
    LocalTime closeTime;
}
