package uk.gegc.gosuraksha.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single source of time for the application.
 *
 * <p>Quota buckets, subscription expiry and event ordering are all compared in UTC, so the
 * application clock is always UTC regardless of the host time zone. Tests replace this bean with a
 * fixed or mutable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
