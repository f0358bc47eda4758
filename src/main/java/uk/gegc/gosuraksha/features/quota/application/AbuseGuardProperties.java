package uk.gegc.gosuraksha.features.quota.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Plan-independent throttles in front of expensive lookups.
 */
@Configuration
@ConfigurationProperties(prefix = "gosuraksha.abuse-guard")
@Validated
@Data
public class AbuseGuardProperties {

    @Valid
    private EmailScan emailScan = new EmailScan();

    @Valid
    private AiInsight aiInsight = new AiInsight();

    @Data
    public static class EmailScan {
        @Min(1)
        private int maxLength = 254;
        /** Lock applied to an account after it exhausts its per-user window. */
        @Min(1)
        private int globalCooldownSeconds = 60;
        /** Same account scanning the same address again within this period is rejected. */
        @Min(1)
        private int duplicateScanBlockSeconds = 120;
        @Min(1)
        private int rateWindowSeconds = 60;
        @Min(1)
        private int rateLimitUser = 8;
        @Min(1)
        private int rateLimitIp = 20;
    }

    @Data
    public static class AiInsight {
        @Min(1)
        private int rateWindowSeconds = 60;
        @Min(1)
        private int rateLimitIp = 20;
    }
}
