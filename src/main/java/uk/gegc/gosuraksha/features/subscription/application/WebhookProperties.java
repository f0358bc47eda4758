package uk.gegc.gosuraksha.features.subscription.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Shared secrets for billing provider callbacks. The RevenueCat secret is mandatory: the
 * application does not start without it.
 */
@Configuration
@ConfigurationProperties(prefix = "gosuraksha.webhooks")
@Validated
@Data
public class WebhookProperties {

    @Valid
    private RevenueCat revenuecat = new RevenueCat();

    @Valid
    private Stripe stripe = new Stripe();

    @Data
    public static class RevenueCat {
        /** Accepted as a bearer credential or as the HMAC-SHA256 key for the signature header. */
        @NotBlank
        private String secret;
    }

    @Data
    public static class Stripe {
        /** Endpoint signing secret ({@code whsec_...}); Stripe callbacks are rejected while unset. */
        private String secret;

        @Min(1)
        private long toleranceSeconds = 300;
    }
}
