package uk.gegc.gosuraksha.features.quota.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.quota.api.dto.EmailScanRequest;
import uk.gegc.gosuraksha.features.quota.api.dto.PlanLimitExceededResponse;
import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeRequiredResponse;
import uk.gegc.gosuraksha.features.quota.application.AbuseGuardService;
import uk.gegc.gosuraksha.features.quota.application.FeatureAccessService;
import uk.gegc.gosuraksha.features.quota.application.QuotaEnforcer;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;
import uk.gegc.gosuraksha.features.subscription.application.CurrentAccountResolver;
import uk.gegc.gosuraksha.shared.config.OpenApiGroupConfig;
import uk.gegc.gosuraksha.shared.web.ClientIpResolver;

/**
 * Consumption endpoints called by the scan services before they do any work. A 204 means the
 * unit was consumed.
 */
@RestController
@RequestMapping("/api/v1/usage")
@RequiredArgsConstructor
@Tag(name = "Usage", description = "Plan quota consumption and abuse guards")
@SecurityRequirement(name = OpenApiGroupConfig.BEARER_SCHEME)
public class UsageController {

    private final CurrentAccountResolver currentAccountResolver;
    private final QuotaEnforcer quotaEnforcer;
    private final AbuseGuardService abuseGuardService;
    private final FeatureAccessService featureAccessService;
    private final ClientIpResolver clientIpResolver;

    @Operation(
            summary = "Consume one unit of a quota",
            description = "Counts one use against the effective plan's limit for the given window."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Unit consumed"),
            @ApiResponse(responseCode = "429", description = "Plan limit reached",
                    content = @Content(schema = @Schema(implementation = PlanLimitExceededResponse.class))),
            @ApiResponse(responseCode = "503", description = "Rate limiter unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{limitType}")
    public ResponseEntity<Void> consume(
            @Parameter(description = "Quota to consume, e.g. THREAT_DAILY", required = true) @PathVariable LimitType limitType,
            Authentication authentication,
            HttpServletRequest request) {
        Account account = currentAccountResolver.resolve(authentication);
        quotaEnforcer.enforce(account, limitType, request.getRequestURI());
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Authorise an email breach scan",
            description = "Applies the email-scan abuse guards, then consumes one unit of the monthly email quota."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Scan authorised"),
            @ApiResponse(responseCode = "400", description = "Invalid email",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Abuse guard or plan limit reached"),
            @ApiResponse(responseCode = "503", description = "Rate limiter unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/email-scan")
    public ResponseEntity<Void> authorizeEmailScan(
            @Valid @RequestBody EmailScanRequest body,
            Authentication authentication,
            HttpServletRequest request) {
        Account account = currentAccountResolver.resolve(authentication);
        abuseGuardService.guardEmailScan(account.getId(), body.email(), clientIpResolver.resolve(request));
        quotaEnforcer.enforce(account, LimitType.EMAIL_MONTHLY, request.getRequestURI());
        abuseGuardService.recordEmailScan(account.getId(), body.email());
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Authorise an AI insight request",
            description = "Applies the per-network AI insight guard and requires the AI_EXPLAIN feature."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Request authorised"),
            @ApiResponse(responseCode = "403", description = "Upgrade required",
                    content = @Content(schema = @Schema(implementation = UpgradeRequiredResponse.class))),
            @ApiResponse(responseCode = "429", description = "Too many requests from this network",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/ai-insight")
    public ResponseEntity<Void> authorizeAiInsight(Authentication authentication, HttpServletRequest request) {
        Account account = currentAccountResolver.resolve(authentication);
        abuseGuardService.guardAiInsight(clientIpResolver.resolve(request));
        featureAccessService.requireFeature(account, Feature.AI_EXPLAIN, request.getRequestURI());
        return ResponseEntity.noContent().build();
    }
}
