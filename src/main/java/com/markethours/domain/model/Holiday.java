package com.markethours.domain.model;

import com.markethours.domain.enums.ClosureKind;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A committed holiday on the exchange calendar. At most one per date.
 *
 * <p>EARLY_CLOSE holidays are paired with an {@link EarlyCloseOverride} for the same date;
 * the override carries the closing time the classifier uses.
 */
@Value
@Builder
public class Holiday {

    LocalDate date;
    String name;
    ClosureKind closureKind;

    public boolean isFullClosure() {
        return closureKind == ClosureKind.FULL_CLOSURE;
    }
}
