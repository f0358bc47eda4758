package uk.gegc.gosuraksha.features.quota.domain.model;

/**
 * Numeric entitlements looked up per plan. A plan without a value for a limit is unlimited.
 */
public enum PlanLimit {
    TRUSTED_CONTACT_MAX,
    THREAT_DAILY,
    EMAIL_MONTHLY,
    PASSWORD_MONTHLY,
    QR_WEEKLY,
    AI_IMAGE_LIFETIME,
    ANALYZE_DAILY_THREAT,
    ANALYZE_DAILY_EMAIL,
    ANALYZE_DAILY_PASSWORD,
    QR_WEEKLY_SCAN,
    QR_WEEKLY_REPORT
}
