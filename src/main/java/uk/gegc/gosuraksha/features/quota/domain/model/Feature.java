package uk.gegc.gosuraksha.features.quota.domain.model;

/**
 * Product capabilities. The first group is granted per plan; the metered group names the
 * capability behind a usage limit and is only used for upgrade guidance.
 */
public enum Feature {
    EMAIL_BREACH_COUNT,
    EMAIL_BREACH_DETAILS,
    OCR_SCAN,
    AI_EXPLAIN,
    RISK_INSIGHTS,
    CYBER_CARD_ACCESS,
    QR_UNLIMITED,
    TRUSTED_CONTACT_LIMIT,
    FAMILY_ALERTS,
    PRIORITY_SOS,
    ULTRA_PRIORITY_PIPELINE,

    // metered
    THREAT_SCAN,
    PASSWORD_SCAN,
    AI_IMAGE_SCAN
}
