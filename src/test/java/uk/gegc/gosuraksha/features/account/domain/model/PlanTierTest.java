package uk.gegc.gosuraksha.features.account.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PlanTierTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "free, GO_FREE",
            "GO FREE, GO_FREE",
            "gofree, GO_FREE",
            "paid, GO_PRO",
            "Premium, GO_PRO",
            "go_pro, GO_PRO",
            "' ultra ', GO_ULTRA",
            "enterprise, GO_ULTRA",
            "family_basic, FAMILY_BASIC",
            "FAMILY_PRO, FAMILY_PRO",
            "platinum, GO_FREE"
    })
    @DisplayName("aliases normalise to a tier")
    void normalize(String raw, PlanTier expected) {
        assertThat(PlanTier.normalize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("null and blank are free")
    void blank() {
        assertThat(PlanTier.normalize(null)).isEqualTo(PlanTier.GO_FREE);
        assertThat(PlanTier.normalize("  ")).isEqualTo(PlanTier.GO_FREE);
    }

    @Test
    @DisplayName("only the free tier is unpaid")
    void paid() {
        assertThat(PlanTier.GO_FREE.isPaid()).isFalse();
        assertThat(PlanTier.FAMILY_BASIC.isPaid()).isTrue();
    }
}
