package uk.gegc.gosuraksha.features.subscription.infra.provider;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Field helpers shared by the provider adapters.
 */
final class ProviderPayloads {

    // Epoch values above this are milliseconds
    private static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private ProviderPayloads() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * First non-empty text among {@code fields}, or null.
     */
    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    /**
     * First parseable timestamp among {@code fields}. Accepts epoch seconds, epoch milliseconds
     * and ISO-8601 strings; values without an offset are UTC.
     */
    static Instant timestamp(JsonNode node, String... fields) {
        for (String field : fields) {
            Instant parsed = parseTimestamp(node.get(field));
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    static Instant parseTimestamp(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return fromEpoch(value.asLong());
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.chars().allMatch(Character::isDigit)) {
            return fromEpoch(Long.parseLong(text));
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to a zone-less timestamp
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Derives the plan from product identifiers. Family plans are matched before the generic
     * tokens because {@code FAMILY_PRO} also contains {@code PRO}.
     */
    static PlanTier planFromProductTokens(String candidate) {
        String tokens = candidate == null ? "" : candidate.toUpperCase(Locale.ROOT);
        if (tokens.contains("FAMILY_PRO") || tokens.contains("FAMILY-PRO")) {
            return PlanTier.FAMILY_PRO;
        }
        if (tokens.contains("FAMILY")) {
            return PlanTier.FAMILY_BASIC;
        }
        if (tokens.contains("ULTRA") || tokens.contains("ENTERPRISE")) {
            return PlanTier.GO_ULTRA;
        }
        if (tokens.contains("PRO") || tokens.contains("PAID") || tokens.contains("PREMIUM")) {
            return PlanTier.GO_PRO;
        }
        return PlanTier.GO_FREE;
    }

    private static Instant fromEpoch(long epoch) {
        return epoch > MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
    }
}
