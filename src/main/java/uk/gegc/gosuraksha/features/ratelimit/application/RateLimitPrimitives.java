package uk.gegc.gosuraksha.features.ratelimit.application;

import uk.gegc.gosuraksha.features.ratelimit.domain.model.LimitWindow;

/**
 * Reusable counting patterns on the shared counter store. None of them keep state in process
 * memory, and none of them return "allowed" when the store is unreachable: a
 * {@code CounterStoreUnavailableException} propagates instead.
 *
 * <p>Subject parts identify who is being counted (account id, IP, e-mail hash, limit name) and are
 * hashed into the key together with the namespace.
 */
public interface RateLimitPrimitives {

    /**
     * Counts one event in the current UTC calendar bucket of {@code window}.
     *
     * @return true if the event is within {@code ceiling} for the bucket
     */
    boolean fixedBucketIncrement(String namespace, LimitWindow window, int ceiling, String... subjectParts);

    /**
     * Admits one event if fewer than {@code ceiling} events were admitted in the last
     * {@code windowSeconds}. Two application instances with skewed clocks can admit one extra
     * event near the window edge; burst smoothing is preferred over exactness here.
     */
    boolean slidingWindowAllow(String namespace, int windowSeconds, int ceiling, String... subjectParts);

    /**
     * @return true only for the first caller within {@code ttlSeconds}
     */
    boolean acquireCooldown(String namespace, int ttlSeconds, String... subjectParts);

    boolean isCooldownActive(String namespace, String... subjectParts);

    /**
     * Records that {@code subjectParts} were seen. Same store operation as a cooldown, named for
     * idempotency checks.
     *
     * @return true the first time within {@code ttlSeconds}, false for repeats
     */
    default boolean markFirstSeen(String namespace, int ttlSeconds, String... subjectParts) {
        return acquireCooldown(namespace, ttlSeconds, subjectParts);
    }
}
