package uk.gegc.gosuraksha.features.subscription.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.gosuraksha.features.subscription.api.dto.WebhookAckResponse;
import uk.gegc.gosuraksha.features.subscription.application.SubscriptionWebhookService;
import uk.gegc.gosuraksha.features.subscription.application.WebhookOutcome;

@Slf4j
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Tag(name = "Subscription Webhooks", description = "Internal endpoints for billing provider callbacks (not for public use)")
public class SubscriptionWebhookController {

    private final SubscriptionWebhookService webhookService;

    @Operation(
            summary = "Handle billing provider webhook",
            description = "Verifies the callback, records it in the event ledger and applies it to the account subscription."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event applied, ignored as out of order, or acknowledged as duplicate"),
            @ApiResponse(responseCode = "400", description = "Malformed event",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown provider or account",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent duplicate delivery")
    })
    @Hidden // Hide from public Swagger UI
    @PostMapping("/{provider}")
    public ResponseEntity<WebhookAckResponse> handleWebhook(
            @Parameter(description = "Billing provider, e.g. revenuecat or stripe") @PathVariable String provider,
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(hidden = true) @RequestHeader HttpHeaders headers
    ) {
        WebhookOutcome outcome = webhookService.process(provider, payload, headers);
        return ResponseEntity.ok(WebhookAckResponse.from(outcome));
    }
}
