package uk.gegc.gosuraksha.features.subscription.domain.exception;

public class UnsupportedBillingProviderException extends RuntimeException {
    public UnsupportedBillingProviderException(String provider) {
        super("Unsupported billing provider: " + provider);
    }
}
