package uk.gegc.gosuraksha.shared.audit;

public enum AuditEventType {
    PLAN_LIMIT_EXCEEDED,
    UPGRADE_REQUIRED,
    RATE_LIMIT_BLOCKED,
    SUBSCRIPTION_WEBHOOK_EVENT,
    SUBSCRIPTION_UPDATED,
    SUBSCRIPTION_AUTO_DOWNGRADE
}
