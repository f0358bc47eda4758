package uk.gegc.gosuraksha.features.ratelimit.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Counter store key layout and quota cooldown settings.
 */
@Configuration
@ConfigurationProperties(prefix = "gosuraksha.rate-limit")
@Validated
@Data
public class RateLimitProperties {

    /** First segment of every counter store key. */
    @NotBlank
    private String keyPrefix = "gosuraksha";

    /** Seconds a subject stays short-circuited after a quota denial. */
    @Min(1)
    private int breachCooldownSeconds = 60;

    /** Extra seconds a sliding-window set outlives its window. */
    @Min(0)
    private int slidingWindowTtlSlackSeconds = 5;
}
