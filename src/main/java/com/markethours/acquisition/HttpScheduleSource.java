package com.markethours.acquisition;

import com.markethours.calendar.MarketCalendarProperties;
import com.markethours.domain.model.RawScheduleRecords;
import com.markethours.domain.model.YearRange;
import com.markethours.exception.AcquisitionException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Fetches the schedule document over HTTP and hands it to {@link ScheduleDocumentParser}.
 *
 * <p>Connect and read timeouts are set on the injected {@link RestTemplate} (see
 * {@code AcquisitionConfig}); a timeout surfaces as {@link AcquisitionException} like any other
 * transport failure. Transient failures are retried with a Resilience4j {@link Retry} up to
 * {@code market-calendar.refresh.max-attempts}. Parse errors are not retried: the same
 * document would fail the same way.
 */
@Component
public class HttpScheduleSource implements ScheduleSource {

    private static final Logger log = LoggerFactory.getLogger(HttpScheduleSource.class);

    private final RestTemplate restTemplate;
    private final ScheduleDocumentParser scheduleDocumentParser;
    private final MarketCalendarProperties marketCalendarProperties;
    private final Clock clock;
    private final Retry retry;

    public HttpScheduleSource(
            @Qualifier("scheduleRestTemplate") RestTemplate restTemplate,
            ScheduleDocumentParser scheduleDocumentParser,
            MarketCalendarProperties marketCalendarProperties,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.scheduleDocumentParser = scheduleDocumentParser;
        this.marketCalendarProperties = marketCalendarProperties;
        this.clock = clock;

        MarketCalendarProperties.Refresh refresh = marketCalendarProperties.getRefresh();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, refresh.getMaxAttempts()))
                .waitDuration(refresh.getRetryWait())
                .retryExceptions(AcquisitionException.class)
                .build();
        this.retry = Retry.of("scheduleSource", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Schedule fetch attempt {} failed, retrying: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public RawScheduleRecords fetchSchedule(YearRange yearRange) {
        String url = marketCalendarProperties.getRefresh().getSourceUrl();
        if (url == null || url.isBlank()) {
            throw new AcquisitionException("No schedule source URL configured (market-calendar.refresh.source-url)");
        }

        String body = retry.executeSupplier(() -> fetchOnce(url, yearRange));
        RawScheduleRecords records = scheduleDocumentParser.parse(body, name(), yearRange, clock.instant());
        log.info("Fetched {} schedule rows for {} from {}", records.getRecords().size(), yearRange, records.getSource());
        return records;
    }

    @Override
    public String name() {
        return marketCalendarProperties.getRefresh().getSourceName();
    }

    private String fetchOnce(String url, YearRange yearRange) {
        Map<String, Object> uriVariables = Map.of("from", yearRange.getFirstYear(), "to", yearRange.getLastYear());
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class, uriVariables);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new AcquisitionException("Schedule source returned HTTP " + response.getStatusCode().value());
            }
            return response.getBody();
        } catch (ResourceAccessException e) {
            throw new AcquisitionException("Schedule source unreachable or timed out: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new AcquisitionException("Schedule source returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new AcquisitionException("Schedule fetch failed: " + e.getMessage(), e);
        }
    }
}
