package com.markethours.calendar;

import com.markethours.domain.enums.ClosureKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the market calendar, bound from the {@code market-calendar} prefix.
 *
 * <pre>
 * market-calendar.exchange=NYSE
 * market-calendar.refresh.enabled=true
 * market-calendar.refresh.schedule-hour=6          # UTC hour of the daily refresh
 * market-calendar.refresh.timeout=30s
 * market-calendar.refresh.max-attempts=2
 * market-calendar.refresh.run-on-startup=true
 * market-calendar.refresh.source-url=https://.../holidays?from={from}&amp;to={to}
 * market-calendar.bootstrap[0].date=2025-01-01 ...
 * </pre>
 *
 * <p>The bootstrap list is only used to build the published snapshot when the database has
 * never received a successful refresh. It is never written to the database.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "market-calendar")
public class MarketCalendarProperties {

    @NotBlank
    private String exchange = "NYSE";

    @Valid
    private Refresh refresh = new Refresh();
    private List<BootstrapHoliday> bootstrap = new ArrayList<>();

    @Data
    public static class Refresh {

        private boolean enabled = true;

        /** Hour of day (0-23, UTC) at which the daily refresh runs. */
        @Min(0)
        @Max(23)
        private int scheduleHour = 6;

        /** Connect and read timeout for the upstream fetch. */
        private Duration timeout = Duration.ofSeconds(30);

        /** Attempts per cycle for transient fetch failures. Parse errors are never retried. */
        @Min(1)
        private int maxAttempts = 2;

        private Duration retryWait = Duration.ofSeconds(2);

        private boolean runOnStartup = true;

        /** Upstream schedule URL; {from} and {to} expand to the first and last year fetched. */
        private String sourceUrl;

        private String sourceName = "NYSE";
    }

    /** A single holiday entry of the bootstrap calendar. */
    @Data
    public static class BootstrapHoliday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;

        private String name;
        private ClosureKind type = ClosureKind.FULL_CLOSURE;

        /** Required when type is EARLY_CLOSE. */
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime closeTime;
    }
}
