package uk.gegc.gosuraksha.features.subscription.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.gosuraksha.features.account.domain.exception.AccountNotFoundException;
import uk.gegc.gosuraksha.features.subscription.api.dto.WebhookAckResponse;
import uk.gegc.gosuraksha.features.subscription.domain.exception.DuplicateSubscriptionEventException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.MalformedSubscriptionEventException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.UnsupportedBillingProviderException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.WebhookAuthenticationException;
import uk.gegc.gosuraksha.shared.api.problem.ErrorTypes;
import uk.gegc.gosuraksha.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps webhook and subscription failures to RFC 7807 Problem Detail responses.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.gosuraksha.features.subscription.api")
public class SubscriptionErrorHandler {

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleWebhookAuthentication(WebhookAuthenticationException ex, HttpServletRequest request) {
        log.warn("Webhook authentication failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.WEBHOOK_INVALID_SIGNATURE,
                "Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
    }

    @ExceptionHandler(MalformedSubscriptionEventException.class)
    public ResponseEntity<ProblemDetail> handleMalformedEvent(MalformedSubscriptionEventException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_SUBSCRIPTION_EVENT,
                "Malformed Subscription Event",
                ex.getMessage(),
                request
        );
        if (ex.getEventType() != null) {
            problem.setProperty("eventType", ex.getEventType());
        }
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleAccountNotFound(AccountNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.ACCOUNT_NOT_FOUND,
                "Account Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(UnsupportedBillingProviderException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedProvider(UnsupportedBillingProviderException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.UNSUPPORTED_BILLING_PROVIDER,
                "Unsupported Billing Provider",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(DuplicateSubscriptionEventException.class)
    public ResponseEntity<WebhookAckResponse> handleDuplicateEvent(DuplicateSubscriptionEventException ex) {
        log.info("Acknowledging concurrent duplicate delivery of event {}", ex.getEventId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(WebhookAckResponse.duplicate(ex.getEventId()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Subscription store failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.SUBSCRIPTION_STORE_UNAVAILABLE,
                "Subscription Store Unavailable",
                "Subscription update could not be stored, retry later",
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }
}
