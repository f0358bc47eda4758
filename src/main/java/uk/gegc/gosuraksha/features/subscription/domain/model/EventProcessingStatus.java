package uk.gegc.gosuraksha.features.subscription.domain.model;

public enum EventProcessingStatus {
    RECEIVED,
    APPLIED,
    IGNORED_OUT_OF_ORDER,
    /** Reported to callers only; a redelivery never creates a second ledger row to carry it. */
    DUPLICATE
}
