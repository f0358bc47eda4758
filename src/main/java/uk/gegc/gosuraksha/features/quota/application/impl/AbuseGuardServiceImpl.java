package uk.gegc.gosuraksha.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.gosuraksha.features.quota.application.AbuseGuardProperties;
import uk.gegc.gosuraksha.features.quota.application.AbuseGuardService;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitPrimitives;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;
import uk.gegc.gosuraksha.shared.exception.RateLimitExceededException;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AbuseGuardServiceImpl implements AbuseGuardService {

    static final String EMAIL_COOLDOWN = "email-scan:cooldown";
    static final String EMAIL_DUPLICATE = "email-scan:duplicate";
    static final String EMAIL_USER_WINDOW = "email-scan:user";
    static final String EMAIL_IP_WINDOW = "email-scan:ip";
    static final String AI_INSIGHT_IP_WINDOW = "ai-insight:ip";

    private final RateLimitPrimitives primitives;
    private final AbuseGuardProperties properties;
    private final AuditLogService auditLogService;
    private final UsageMetricsService metricsService;

    @Override
    public void guardEmailScan(UUID accountId, String email, String clientIp) {
        AbuseGuardProperties.EmailScan cfg = properties.getEmailScan();
        if (email == null || email.isBlank() || email.length() > cfg.getMaxLength()) {
            throw new IllegalArgumentException("Email must be between 1 and " + cfg.getMaxLength() + " characters");
        }
        String account = accountId.toString();
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

        if (primitives.isCooldownActive(EMAIL_COOLDOWN, account)) {
            throw deny(accountId, "email_scan_cooldown", "Too many email scans. Please wait before trying again.",
                    cfg.getGlobalCooldownSeconds());
        }

        if (!primitives.slidingWindowAllow(EMAIL_USER_WINDOW, cfg.getRateWindowSeconds(), cfg.getRateLimitUser(), account)) {
            primitives.acquireCooldown(EMAIL_COOLDOWN, cfg.getGlobalCooldownSeconds(), account);
            throw deny(accountId, "email_scan_user_rate", "Too many email scans. Please wait before trying again.",
                    cfg.getGlobalCooldownSeconds());
        }

        if (clientIp != null && !primitives.slidingWindowAllow(EMAIL_IP_WINDOW, cfg.getRateWindowSeconds(), cfg.getRateLimitIp(), clientIp)) {
            throw deny(accountId, "email_scan_ip_rate", "Too many email scans from this network.",
                    cfg.getRateWindowSeconds());
        }

        // Read only; the address is marked by recordEmailScan once the scan is admitted
        if (primitives.isCooldownActive(EMAIL_DUPLICATE, account, normalizedEmail)) {
            throw deny(accountId, "email_scan_duplicate", "This email was scanned moments ago.",
                    cfg.getDuplicateScanBlockSeconds());
        }
    }

    @Override
    public void recordEmailScan(UUID accountId, String email) {
        AbuseGuardProperties.EmailScan cfg = properties.getEmailScan();
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (!primitives.markFirstSeen(EMAIL_DUPLICATE, cfg.getDuplicateScanBlockSeconds(),
                accountId.toString(), normalizedEmail)) {
            log.debug("Email scan for account {} was already marked by a concurrent request", accountId);
        }
    }

    @Override
    public void guardAiInsight(String clientIp) {
        AbuseGuardProperties.AiInsight cfg = properties.getAiInsight();
        if (clientIp == null) {
            return;
        }
        if (!primitives.slidingWindowAllow(AI_INSIGHT_IP_WINDOW, cfg.getRateWindowSeconds(), cfg.getRateLimitIp(), clientIp)) {
            throw deny(null, "ai_insight_ip_rate", "Too many AI insight requests from this network.",
                    cfg.getRateWindowSeconds());
        }
    }

    private RateLimitExceededException deny(UUID accountId, String guard, String message, long retryAfterSeconds) {
        log.info("Abuse guard {} rejected request for account {}", guard, accountId);
        metricsService.incrementAbuseGuardDenied(guard);
        auditLogService.record(accountId, AuditEventType.RATE_LIMIT_BLOCKED, Map.of("guard", guard));
        return new RateLimitExceededException(guard, message, retryAfterSeconds);
    }
}
