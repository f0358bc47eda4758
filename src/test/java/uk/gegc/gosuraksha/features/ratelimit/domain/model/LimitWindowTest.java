package uk.gegc.gosuraksha.features.ratelimit.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LimitWindow")
class LimitWindowTest {

    // Friday
    private static final Instant FRIDAY_MORNING = Instant.parse("2025-03-14T10:00:00Z");

    @Nested
    @DisplayName("bucket")
    class Bucket {

        @Test
        @DisplayName("uses UTC calendar labels")
        void calendarLabels() {
            assertThat(LimitWindow.DAILY.bucket(FRIDAY_MORNING)).isEqualTo("2025-03-14");
            assertThat(LimitWindow.WEEKLY.bucket(FRIDAY_MORNING)).isEqualTo("2025-W11");
            assertThat(LimitWindow.MONTHLY.bucket(FRIDAY_MORNING)).isEqualTo("2025-03");
        }

        @Test
        @DisplayName("weekly bucket follows the ISO week-based year")
        void weeklyBucketUsesWeekBasedYear() {
            assertThat(LimitWindow.WEEKLY.bucket(Instant.parse("2024-12-30T12:00:00Z"))).isEqualTo("2025-W01");
        }

        @Test
        @DisplayName("last instant of a day and first of the next fall into different buckets")
        void dayRollover() {
            assertThat(LimitWindow.DAILY.bucket(Instant.parse("2025-03-14T23:59:59.999Z"))).isEqualTo("2025-03-14");
            assertThat(LimitWindow.DAILY.bucket(Instant.parse("2025-03-15T00:00:00Z"))).isEqualTo("2025-03-15");
        }

        @Test
        @DisplayName("lifetime has no bucket")
        void lifetimeHasNoBucket() {
            assertThat(LimitWindow.LIFETIME.isCalendarBucket()).isFalse();
            assertThatThrownBy(() -> LimitWindow.LIFETIME.bucket(FRIDAY_MORNING))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("secondsUntilBoundary")
    class SecondsUntilBoundary {

        @Test
        @DisplayName("daily expires at next UTC midnight")
        void daily() {
            assertThat(LimitWindow.DAILY.secondsUntilBoundary(FRIDAY_MORNING)).isEqualTo(14 * 3600L);
        }

        @Test
        @DisplayName("weekly expires at next Monday")
        void weekly() {
            assertThat(LimitWindow.WEEKLY.secondsUntilBoundary(FRIDAY_MORNING)).isEqualTo(62 * 3600L);
            assertThat(LimitWindow.WEEKLY.secondsUntilBoundary(Instant.parse("2025-03-10T00:00:00Z")))
                    .isEqualTo(7 * 86400L);
        }

        @Test
        @DisplayName("monthly expires on the first of next month")
        void monthly() {
            assertThat(LimitWindow.MONTHLY.secondsUntilBoundary(FRIDAY_MORNING)).isEqualTo(17 * 86400L + 14 * 3600L);
        }

        @Test
        @DisplayName("never returns less than one second")
        void atLeastOneSecond() {
            assertThat(LimitWindow.DAILY.secondsUntilBoundary(Instant.parse("2025-03-14T23:59:59.900Z"))).isEqualTo(1L);
        }
    }
}
