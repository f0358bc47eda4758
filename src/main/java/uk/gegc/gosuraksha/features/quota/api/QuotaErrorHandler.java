package uk.gegc.gosuraksha.features.quota.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.gosuraksha.features.quota.api.dto.PlanLimitExceededResponse;
import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeRequiredResponse;
import uk.gegc.gosuraksha.features.quota.domain.exception.PlanLimitExceededException;
import uk.gegc.gosuraksha.features.quota.domain.exception.UpgradeRequiredException;
import uk.gegc.gosuraksha.features.ratelimit.domain.exception.CounterStoreUnavailableException;
import uk.gegc.gosuraksha.shared.api.problem.ErrorTypes;
import uk.gegc.gosuraksha.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

/**
 * Quota and feature-gate denials keep the {@code {"error": {...}}} body that clients already parse;
 * counter store outages are reported as Problem Details.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
@RequiredArgsConstructor
public class QuotaErrorHandler {

    static final long UNAVAILABLE_RETRY_AFTER_SECONDS = 5;

    private final UsageMetricsService metricsService;

    @ExceptionHandler(PlanLimitExceededException.class)
    public ResponseEntity<PlanLimitExceededResponse> handlePlanLimitExceeded(PlanLimitExceededException ex) {
        PlanLimitExceededResponse body = new PlanLimitExceededResponse(new PlanLimitExceededResponse.Body(
                "PLAN_LIMIT_EXCEEDED",
                ex.getMessage(),
                ex.getPlan(),
                ex.getLimitType(),
                ex.getWindow(),
                ex.getLimit(),
                ex.getUpgrade()
        ));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(UpgradeRequiredException.class)
    public ResponseEntity<UpgradeRequiredResponse> handleUpgradeRequired(UpgradeRequiredException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new UpgradeRequiredResponse(ex.getAdvice()));
    }

    @ExceptionHandler(CounterStoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleCounterStoreUnavailable(CounterStoreUnavailableException ex,
                                                                       HttpServletRequest request) {
        metricsService.incrementCounterStoreUnavailable(ex.getOperation());
        log.error("Counter store unavailable during {}: {}", ex.getOperation(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.RATE_LIMITER_UNAVAILABLE,
                "Service Unavailable",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(UNAVAILABLE_RETRY_AFTER_SECONDS))
                .body(problem);
    }
}
