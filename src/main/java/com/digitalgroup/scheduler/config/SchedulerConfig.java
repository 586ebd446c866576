package com.digitalgroup.scheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Scheduler wiring: the time source and the startup sanity checks on timing settings.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    public SchedulerConfig(@Value("${scheduler.min-interval:PT1M}") Duration minInterval,
                           @Value("${scheduler.dispatch.read-timeout:PT30S}") Duration readTimeout) {
        if (readTimeout.compareTo(minInterval) >= 0) {
            throw new IllegalStateException("scheduler.dispatch.read-timeout (" + readTimeout
                    + ") must be shorter than scheduler.min-interval (" + minInterval + ")");
        }
        log.info("Scheduler timing: min interval {}, dispatch read timeout {}", minInterval, readTimeout);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
