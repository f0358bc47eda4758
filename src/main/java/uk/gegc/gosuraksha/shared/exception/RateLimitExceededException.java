package uk.gegc.gosuraksha.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised by the abuse guards when a throttle rejects a request. Not a plan limit: plan limits
 * raise {@code PlanLimitExceededException} with upgrade guidance instead.
 */
@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class RateLimitExceededException extends RuntimeException {
    private final String guard;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String guard, String message, long retryAfterSeconds) {
        super(message);
        this.guard = guard;
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public String getGuard() {
        return guard;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
