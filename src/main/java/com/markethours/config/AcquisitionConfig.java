package com.markethours.config;

import com.markethours.calendar.MarketCalendarProperties;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the upstream holiday schedule. Both timeouts come from
 * {@code market-calendar.refresh.timeout} so a hung upstream can never stall the scheduler.
 */
@Configuration
public class AcquisitionConfig {

    @Bean("scheduleRestTemplate")
    public RestTemplate scheduleRestTemplate(
            RestTemplateBuilder restTemplateBuilder, MarketCalendarProperties marketCalendarProperties) {
        Duration timeout = marketCalendarProperties.getRefresh().getTimeout();
        return restTemplateBuilder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .defaultHeader("User-Agent", "market-hours-service/1.0")
                .build();
    }
}
