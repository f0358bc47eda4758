package uk.gegc.gosuraksha.features.subscription.domain.exception;

public class WebhookAuthenticationException extends RuntimeException {
    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
