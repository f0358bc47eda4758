package uk.gegc.gosuraksha.features.subscription.domain.exception;

/**
 * The payload does not yield a usable canonical event. Raised before any state is touched.
 */
public class MalformedSubscriptionEventException extends RuntimeException {

    private final String eventType;

    public MalformedSubscriptionEventException(String message) {
        this(message, null);
    }

    public MalformedSubscriptionEventException(String message, String eventType) {
        super(message);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
