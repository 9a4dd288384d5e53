package com.markethours.acquisition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.model.RawScheduleRecord;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.YearRange;
import com.markethours.exception.ScheduleParseException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns the upstream JSON schedule document into typed {@link RawScheduleRecords}.
 *
 * <p>Accepted shape:
 * <pre>
 * {
 *   "source": "NYSE",
 *   "holidays": [
 *     {"date": "2024-01-01", "name": "New Year's Day", "type": "FULL_CLOSURE"},
 *     {"date": "2024-07-03", "name": "Independence Day Eve", "type": "EARLY_CLOSE", "closeTime": "13:00"}
 *   ],
 *   "earlyCloses": [
 *     {"date": "2024-11-29", "name": "Day after Thanksgiving", "closeTime": "13:00"}
 *   ]
 * }
 * </pre>
 * {@code holidays} is required; {@code earlyCloses} (or {@code early_closes}) is optional and
 * every entry in it is an EARLY_CLOSE. Anything else that does not fit raises
 * {@link ScheduleParseException}. Semantic checks (duplicates, year range, close-time bounds)
 * belong to the refresh validator, not here.
 */
@Component
public class ScheduleDocumentParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public RawScheduleRecords parse(String body, String defaultSource, YearRange yearRange, Instant fetchedAt) {
        if (body == null || body.isBlank()) {
            throw new ScheduleParseException("Schedule response body is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ScheduleParseException("Schedule response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ScheduleParseException("Schedule response must be a JSON object");
        }

        JsonNode holidays = root.get("holidays");
        if (holidays == null || !holidays.isArray()) {
            throw new ScheduleParseException("Schedule response has no 'holidays' array");
        }

        String source = root.hasNonNull("source") ? root.get("source").asText() : defaultSource;
        RawScheduleRecords.RawScheduleRecordsBuilder builder = RawScheduleRecords.builder()
                .source(source)
                .fetchedAt(fetchedAt)
                .yearRange(yearRange);

        int index = 0;
        for (JsonNode entry : holidays) {
            builder.record(parseEntry(entry, "holidays[" + index++ + "]", null));
        }

        JsonNode earlyCloses = root.has("earlyCloses") ? root.get("earlyCloses") : root.get("early_closes");
        if (earlyCloses != null && !earlyCloses.isNull()) {
            if (!earlyCloses.isArray()) {
                throw new ScheduleParseException("'earlyCloses' must be an array");
            }
            index = 0;
            for (JsonNode entry : earlyCloses) {
                builder.record(parseEntry(entry, "earlyCloses[" + index++ + "]", ClosureKind.EARLY_CLOSE));
            }
        }
        return builder.build();
    }

    private RawScheduleRecord parseEntry(JsonNode entry, String path, ClosureKind forcedKind) {
        if (!entry.isObject()) {
            throw new ScheduleParseException(path + " is not an object");
        }
        LocalDate date = parseDate(requiredText(entry, "date", path), path);
        String name = requiredText(entry, "name", path);
        ClosureKind kind = forcedKind != null ? forcedKind : parseKind(requiredText(entry, "type", path), path);

        LocalTime closeTime = null;
        String closeText = textOrNull(entry, "closeTime");
        if (closeText == null) {
            closeText = textOrNull(entry, "close_time");
        }
        if (kind == ClosureKind.EARLY_CLOSE) {
            if (closeText == null) {
                throw new ScheduleParseException(path + " is an early close without 'closeTime'");
            }
            closeTime = parseTime(closeText, path);
        }

        return RawScheduleRecord.builder()
                .date(date)
                .name(name)
                .closureKind(kind)
                .closeTime(closeTime)
                .build();
    }

    static ClosureKind parseKind(String value, String path) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "FULL_CLOSURE", "FULL", "CLOSED", "HOLIDAY" -> ClosureKind.FULL_CLOSURE;
            case "EARLY_CLOSE", "EARLY", "HALF_DAY" -> ClosureKind.EARLY_CLOSE;
            default -> throw new ScheduleParseException(path + " has unknown type '" + value + "'");
        };
    }

    private static LocalDate parseDate(String value, String path) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ScheduleParseException(path + " has unparseable date '" + value + "'", e);
        }
    }

    private static LocalTime parseTime(String value, String path) {
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ScheduleParseException(path + " has unparseable closeTime '" + value + "'", e);
        }
    }

    private static String requiredText(JsonNode entry, String field, String path) {
        String value = textOrNull(entry, field);
        if (value == null) {
            throw new ScheduleParseException(path + " is missing '" + field + "'");
        }
        return value;
    }

    private static String textOrNull(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
