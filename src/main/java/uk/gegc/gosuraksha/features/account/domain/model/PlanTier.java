package uk.gegc.gosuraksha.features.account.domain.model;

import java.util.Locale;
import java.util.Map;

/**
 * Subscription tiers. Every plan string that enters the system, from the database, a billing
 * provider or a product identifier, is resolved through {@link #normalize(String)}.
 */
public enum PlanTier {
    GO_FREE,
    GO_PRO,
    GO_ULTRA,
    FAMILY_BASIC,
    FAMILY_PRO;

    private static final Map<String, PlanTier> ALIASES = Map.ofEntries(
            Map.entry("FREE", GO_FREE),
            Map.entry("GO FREE", GO_FREE),
            Map.entry("GO_FREE", GO_FREE),
            Map.entry("GOFREE", GO_FREE),
            Map.entry("PAID", GO_PRO),
            Map.entry("PRO", GO_PRO),
            Map.entry("GO PRO", GO_PRO),
            Map.entry("GO_PRO", GO_PRO),
            Map.entry("GOPRO", GO_PRO),
            Map.entry("PREMIUM", GO_PRO),
            Map.entry("ULTRA", GO_ULTRA),
            Map.entry("GO ULTRA", GO_ULTRA),
            Map.entry("GO_ULTRA", GO_ULTRA),
            Map.entry("GOULTRA", GO_ULTRA),
            Map.entry("ENTERPRISE", GO_ULTRA),
            Map.entry("FAMILY_BASIC", FAMILY_BASIC),
            Map.entry("FAMILY_PRO", FAMILY_PRO)
    );

    public boolean isPaid() {
        return this != GO_FREE;
    }

    /**
     * Resolves a raw plan label to a tier. Blank and unknown labels resolve to {@link #GO_FREE}.
     */
    public static PlanTier normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return GO_FREE;
        }
        return ALIASES.getOrDefault(raw.trim().toUpperCase(Locale.ROOT), GO_FREE);
    }
}
