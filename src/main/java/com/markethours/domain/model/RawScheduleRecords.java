package com.markethours.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Typed output of the schedule source. Everything downstream of acquisition works on this
 * shape, so upstream format drift can only surface as a parse error at the source.
 */
@Value
@Builder
public class RawScheduleRecords {

    String source;
    Instant fetchedAt;
    YearRange yearRange;

    @Singular
    List<RawScheduleRecord> records;
}
