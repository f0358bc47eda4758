package uk.gegc.gosuraksha.features.ratelimit.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The counter store could not answer. Quota checks fail closed on this exception; it is never
 * converted into an "allowed" decision.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class CounterStoreUnavailableException extends RuntimeException {

    private final String operation;

    public CounterStoreUnavailableException(String operation, Throwable cause) {
        super("Rate limiter unavailable", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
