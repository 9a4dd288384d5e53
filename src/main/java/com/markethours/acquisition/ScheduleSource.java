package com.markethours.acquisition;

import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.YearRange;

/**
 * Fetches the holiday and early-close schedule for a range of years from an external,
 * authoritative source. Implementations perform network I/O only and never touch the
 * calendar store.
 */
public interface ScheduleSource {

    /**
     * @throws com.markethours.exception.AcquisitionException on network failure, timeout or non-2xx response
     * @throws com.markethours.exception.ScheduleParseException if the response shape is not recognised
     */
    RawScheduleRecords fetchSchedule(YearRange yearRange);

    /** Name recorded on refresh records. */
    String name();
}
