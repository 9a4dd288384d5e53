package com.markethours.domain.model;

import java.time.LocalDate;
import lombok.Value;

/** Inclusive range of calendar years covered by a fetch or a commit. */
@Value
public class YearRange {

    int firstYear;
    int lastYear;

    public static YearRange of(int firstYear, int lastYear) {
        if (lastYear < firstYear) {
            throw new IllegalArgumentException("lastYear " + lastYear + " is before firstYear " + firstYear);
        }
        return new YearRange(firstYear, lastYear);
    }

    /** The given year and the one after it. */
    public static YearRange currentAndNext(int year) {
        return new YearRange(year, year + 1);
    }

    public LocalDate startDate() {
        return LocalDate.of(firstYear, 1, 1);
    }

    public LocalDate endDate() {
        return LocalDate.of(lastYear, 12, 31);
    }

    public boolean contains(LocalDate date) {
        int year = date.getYear();
        return year >= firstYear && year <= lastYear;
    }

    @Override
    public String toString() {
        return firstYear == lastYear ? Integer.toString(firstYear) : firstYear + "-" + lastYear;
    }
}
