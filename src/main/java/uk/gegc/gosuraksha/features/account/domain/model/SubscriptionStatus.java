package uk.gegc.gosuraksha.features.account.domain.model;

public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED,
    CANCELED,
    GRACE
}
