package com.markethours.refresh;

import com.markethours.calendar.ExchangeHours;
import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.model.EarlyCloseOverride;
import com.markethours.domain.model.Holiday;
import com.markethours.domain.model.RawScheduleRecord;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.YearRange;
import com.markethours.entity.HolidayEntity;
import com.markethours.exception.ScheduleValidationException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks a fetched schedule for internal consistency before anything is committed:
 * <ul>
 *   <li>every row has a date inside the requested year range</li>
 *   <li>no two rows share a date</li>
 *   <li>every row has a closure kind and a non-blank name that fits the holidays table</li>
 *   <li>EARLY_CLOSE rows have a close time strictly between 09:30 and 16:00</li>
 * </ul>
 * All violations are collected and reported together.
 */
@Component
public class ScheduleValidator {

    public ValidatedSchedule validate(RawScheduleRecords raw, YearRange expectedRange) {
        List<String> violations = new ArrayList<>();
        if (raw == null || raw.getRecords() == null) {
            throw new ScheduleValidationException(List.of("schedule is missing"));
        }

        List<Holiday> holidays = new ArrayList<>();
        List<EarlyCloseOverride> overrides = new ArrayList<>();
        Set<LocalDate> seen = new HashSet<>();

        int row = 0;
        for (RawScheduleRecord record : raw.getRecords()) {
            String label = "row " + row++;
            LocalDate date = record.getDate();
            if (date == null) {
                violations.add(label + ": missing date");
                continue;
            }
            label = date.toString();
            if (!expectedRange.contains(date)) {
                violations.add(label + ": outside expected years " + expectedRange);
            }
            if (!seen.add(date)) {
                violations.add(label + ": duplicate date");
            }
            if (record.getName() == null || record.getName().isBlank()) {
                violations.add(label + ": blank name");
            } else if (record.getName().length() > HolidayEntity.NAME_MAX_LENGTH) {
                violations.add(String.format(
                        "%s: name longer than %d characters", label, HolidayEntity.NAME_MAX_LENGTH));
            }
            if (record.getClosureKind() == null) {
                violations.add(label + ": missing closure kind");
                continue;
            }
            if (record.getClosureKind() == ClosureKind.EARLY_CLOSE) {
                if (record.getCloseTime() == null) {
                    violations.add(label + ": early close without close time");
                } else if (!ExchangeHours.isStrictlyWithinRegularSession(record.getCloseTime())) {
                    violations.add(String.format(
                            "%s: early close time %s not strictly between %s and %s",
                            label, record.getCloseTime(), ExchangeHours.REGULAR_OPEN, ExchangeHours.REGULAR_CLOSE));
                } else {
                    overrides.add(EarlyCloseOverride.builder()
                            .date(date)
                            .closeTime(record.getCloseTime())
                            .build());
                }
            }
            holidays.add(Holiday.builder()
                    .date(date)
                    .name(record.getName())
                    .closureKind(record.getClosureKind())
                    .build());
        }

        if (!violations.isEmpty()) {
            throw new ScheduleValidationException(violations);
        }
        return ValidatedSchedule.builder()
                .yearRange(expectedRange)
                .source(raw.getSource())
                .holidays(List.copyOf(holidays))
                .overrides(List.copyOf(overrides))
                .build();
    }
}
