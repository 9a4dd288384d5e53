package com.markethours.unit.acquisition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.markethours.acquisition.ScheduleDocumentParser;
import com.markethours.domain.enums.ClosureKind;
import com.markethours.domain.model.RawScheduleRecord;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.YearRange;
import com.markethours.exception.ScheduleParseException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class ScheduleDocumentParserTest {

    private static final YearRange YEARS = YearRange.of(2024, 2025);
    private static final Instant FETCHED_AT = Instant.parse("2024-03-01T06:00:00Z");

    private final ScheduleDocumentParser parser = new ScheduleDocumentParser();

    @Test
    void parse_holidaysAndEarlyCloses() {
        String body = """
                {
                  "source": "NYSE website",
                  "holidays": [
                    {"date": "2024-01-01", "name": "New Year's Day", "type": "FULL_CLOSURE"},
                    {"date": "2024-07-03", "name": "Independence Day Eve", "type": "early-close", "closeTime": "13:00"}
                  ],
                  "early_closes": [
                    {"date": "2024-11-29", "name": "Day after Thanksgiving", "close_time": "13:00"}
                  ]
                }
                """;

        RawScheduleRecords records = parser.parse(body, "NYSE", YEARS, FETCHED_AT);

        assertThat(records.getSource()).isEqualTo("NYSE website");
        assertThat(records.getFetchedAt()).isEqualTo(FETCHED_AT);
        assertThat(records.getYearRange()).isEqualTo(YEARS);
        assertThat(records.getRecords()).containsExactly(
                RawScheduleRecord.builder().date(LocalDate.of(2024, 1, 1)).name("New Year's Day")
                        .closureKind(ClosureKind.FULL_CLOSURE).build(),
                RawScheduleRecord.builder().date(LocalDate.of(2024, 7, 3)).name("Independence Day Eve")
                        .closureKind(ClosureKind.EARLY_CLOSE).closeTime(LocalTime.of(13, 0)).build(),
                RawScheduleRecord.builder().date(LocalDate.of(2024, 11, 29)).name("Day after Thanksgiving")
                        .closureKind(ClosureKind.EARLY_CLOSE).closeTime(LocalTime.of(13, 0)).build());
    }

    @Test
    void parse_missingSource_usesDefault() {
        RawScheduleRecords records = parser.parse("{\"holidays\": []}", "NYSE", YEARS, FETCHED_AT);

        assertThat(records.getSource()).isEqualTo("NYSE");
        assertThat(records.getRecords()).isEmpty();
    }

    @Test
    void parse_closeTimeIgnoredForFullClosure() {
        String body = "{\"holidays\": [{\"date\": \"2024-12-25\", \"name\": \"Christmas\", \"type\": \"holiday\","
                + " \"closeTime\": \"13:00\"}]}";

        RawScheduleRecord record = parser.parse(body, "NYSE", YEARS, FETCHED_AT).getRecords().get(0);

        assertThat(record.getClosureKind()).isEqualTo(ClosureKind.FULL_CLOSURE);
        assertThat(record.getCloseTime()).isNull();
    }

    @Test
    void parse_htmlBody_throwsParseError() {
        assertThatThrownBy(() -> parser.parse("<html>Holidays</html>", "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void parse_emptyBody_throwsParseError() {
        assertThatThrownBy(() -> parser.parse("  ", "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class);
    }

    @Test
    void parse_missingHolidaysArray_throwsParseError() {
        assertThatThrownBy(() -> parser.parse("{\"days\": []}", "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("holidays");
    }

    @Test
    void parse_unknownType_throwsParseError() {
        String body = "{\"holidays\": [{\"date\": \"2024-12-25\", \"name\": \"Christmas\", \"type\": \"PARTIAL\"}]}";

        assertThatThrownBy(() -> parser.parse(body, "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("holidays[0]")
                .hasMessageContaining("PARTIAL");
    }

    @Test
    void parse_badDate_throwsParseError() {
        String body = "{\"holidays\": [{\"date\": \"12/25/2024\", \"name\": \"Christmas\", \"type\": \"FULL\"}]}";

        assertThatThrownBy(() -> parser.parse(body, "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("12/25/2024");
    }

    @Test
    void parse_earlyCloseWithoutCloseTime_throwsParseError() {
        String body = "{\"holidays\": [{\"date\": \"2024-07-03\", \"name\": \"Eve\", \"type\": \"EARLY_CLOSE\"}]}";

        assertThatThrownBy(() -> parser.parse(body, "NYSE", YEARS, FETCHED_AT))
                .isInstanceOf(ScheduleParseException.class)
                .hasMessageContaining("closeTime");
    }
}
