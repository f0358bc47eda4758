package uk.gegc.gosuraksha.features.ratelimit.domain.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Calendar periods a quota counter is scoped to. All buckets are UTC so every instance hashes the
 * same request into the same key.
 */
public enum LimitWindow {
    DAILY,
    WEEKLY,
    MONTHLY,
    /** Never resets; not backed by the counter store. */
    LIFETIME;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT);

    public boolean isCalendarBucket() {
        return this != LIFETIME;
    }

    /**
     * Bucket label for the period containing {@code now}: {@code 2025-03-14}, {@code 2025-W11} or
     * {@code 2025-03}.
     */
    public String bucket(Instant now) {
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        return switch (this) {
            case DAILY -> DAY.format(utc);
            case WEEKLY -> String.format(Locale.ROOT, "%d-W%02d",
                    utc.get(IsoFields.WEEK_BASED_YEAR), utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTHLY -> MONTH.format(utc);
            case LIFETIME -> throw new IllegalStateException("Lifetime limits have no calendar bucket");
        };
    }

    /**
     * Whole seconds from {@code now} until the next period boundary, at least 1. Used as the
     * counter's expiry so it disappears exactly when the period rolls over.
     */
    public long secondsUntilBoundary(Instant now) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate next = switch (this) {
            case DAILY -> today.plusDays(1);
            case WEEKLY -> today.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
            case MONTHLY -> today.with(TemporalAdjusters.firstDayOfNextMonth());
            case LIFETIME -> throw new IllegalStateException("Lifetime limits never expire");
        };
        long seconds = Duration.between(now, next.atStartOfDay(ZoneOffset.UTC).toInstant()).toSeconds();
        return Math.max(1, seconds);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
