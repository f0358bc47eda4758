package uk.gegc.gosuraksha.features.subscription.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.application.FeatureAccessService;
import uk.gegc.gosuraksha.features.quota.application.PlanPolicy;
import uk.gegc.gosuraksha.features.quota.application.UpgradeAdvisor;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.subscription.api.dto.FeatureAccessResponse;
import uk.gegc.gosuraksha.features.subscription.api.dto.SubscriptionSummaryResponse;
import uk.gegc.gosuraksha.features.subscription.application.CurrentAccountResolver;
import uk.gegc.gosuraksha.shared.config.OpenApiGroupConfig;

@RestController
@RequestMapping("/api/v1/subscription")
@RequiredArgsConstructor
@Tag(name = "Subscription", description = "Effective plan, features and limits of the current account")
@SecurityRequirement(name = OpenApiGroupConfig.BEARER_SCHEME)
public class SubscriptionController {

    private final CurrentAccountResolver currentAccountResolver;
    private final PlanPolicy planPolicy;
    private final UpgradeAdvisor upgradeAdvisor;
    private final FeatureAccessService featureAccessService;

    @Operation(
            summary = "Get current subscription",
            description = "Returns the effective plan after lapsed subscriptions are downgraded, with its features and limits."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription summary",
                    content = @Content(schema = @Schema(implementation = SubscriptionSummaryResponse.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Account not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me")
    public ResponseEntity<SubscriptionSummaryResponse> getCurrentSubscription(Authentication authentication) {
        Account account = currentAccountResolver.resolve(authentication);
        PlanTier plan = account.getPlan();
        return ResponseEntity.ok(new SubscriptionSummaryResponse(
                plan,
                account.getSubscriptionStatus(),
                account.getSubscriptionExpiresAt(),
                account.isFirstUpgradeUsed(),
                planPolicy.featuresOf(plan),
                planPolicy.limitsOf(plan),
                account.getAiImageLifetimeUsed(),
                upgradeAdvisor.discountFor(account)
        ));
    }

    @Operation(
            summary = "Check feature access",
            description = "Returns 200 when the effective plan includes the feature, otherwise 403 with upgrade advice."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Feature available",
                    content = @Content(schema = @Schema(implementation = FeatureAccessResponse.class))),
            @ApiResponse(responseCode = "403", description = "Upgrade required"),
            @ApiResponse(responseCode = "400", description = "Unknown feature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/me/features/{feature}")
    public ResponseEntity<FeatureAccessResponse> checkFeature(
            @Parameter(description = "Feature name, e.g. AI_EXPLAIN", required = true) @PathVariable Feature feature,
            Authentication authentication) {
        Account account = currentAccountResolver.resolve(authentication);
        featureAccessService.requireFeature(account, feature, "/api/v1/subscription/me/features/" + feature.name());
        return ResponseEntity.ok(new FeatureAccessResponse(feature, account.getPlan(), true));
    }
}
