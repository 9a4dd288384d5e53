package com.markethours.domain.model;

import com.markethours.domain.enums.ClosureKind;
import java.time.LocalDate;
import java.time.LocalTime;
import lombok.Builder;
import lombok.Value;

/** One parsed, not yet validated, row of the upstream holiday schedule. */
@Value
@Builder
public class RawScheduleRecord {

    LocalDate date;
    String name;
    ClosureKind closureKind;

    /** Present only for EARLY_CLOSE rows. */
    LocalTime closeTime;
}
