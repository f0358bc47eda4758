package uk.gegc.gosuraksha.features.subscription.domain.exception;

/**
 * A concurrent delivery of the same event won the ledger insert after this one passed the
 * idempotency pre-check.
 */
public class DuplicateSubscriptionEventException extends RuntimeException {

    private final String eventId;

    public DuplicateSubscriptionEventException(String eventId, Throwable cause) {
        super("Subscription event " + eventId + " already processed", cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
