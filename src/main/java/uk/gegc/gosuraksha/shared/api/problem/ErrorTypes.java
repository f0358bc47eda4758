package uk.gegc.gosuraksha.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://gosuraksha.app/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI ACCOUNT_NOT_FOUND = URI.create(BASE_URL + "/account-not-found");
    public static final URI UNSUPPORTED_BILLING_PROVIDER = URI.create(BASE_URL + "/unsupported-billing-provider");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");
    public static final URI RATE_LIMITER_UNAVAILABLE = URI.create(BASE_URL + "/rate-limiter-unavailable");

    // ==================== Subscription Webhooks ====================
    public static final URI WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/webhook-invalid-signature");
    public static final URI MALFORMED_SUBSCRIPTION_EVENT = URI.create(BASE_URL + "/malformed-subscription-event");
    public static final URI SUBSCRIPTION_STORE_UNAVAILABLE = URI.create(BASE_URL + "/subscription-store-unavailable");

    // ==================== Infrastructure ====================
    public static final URI ACCOUNT_STORE_UNAVAILABLE = URI.create(BASE_URL + "/account-store-unavailable");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
