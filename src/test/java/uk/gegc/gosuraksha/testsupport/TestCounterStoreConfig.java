package uk.gegc.gosuraksha.testsupport;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Replaces the Redis counter store in application-context tests.
 */
@TestConfiguration
public class TestCounterStoreConfig {

    @Bean
    @Primary
    InMemoryCounterStore inMemoryCounterStore(Clock clock) {
        return new InMemoryCounterStore(clock);
    }
}
