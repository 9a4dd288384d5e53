package com.markethours.refresh;

import com.markethours.domain.model.EarlyCloseOverride;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.YearRange;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Schedule that passed validation and is ready to commit for {@code yearRange}. */
@Value
@Builder
public class ValidatedSchedule {

    YearRange yearRange;
    String source;
    List<Holiday> holidays;
    List<EarlyCloseOverride> overrides;

    public int recordCount() {
        return holidays.size();
    }
}
