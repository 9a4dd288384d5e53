package com.markethours.domain.enums;

/**
 * Classifies a holiday on the US equity calendar.
 *
 * <p>FULL_CLOSURE means the exchange does not open at all. EARLY_CLOSE opens at the
 * regular time but closes before 16:00 ET; the closing time itself lives on the paired
 * early-close override.
 */
public enum ClosureKind {

    /** Full day holiday - no trading. */
    FULL_CLOSURE,

    /** Half day: regular open, early close. */
    EARLY_CLOSE
}
