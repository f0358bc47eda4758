package uk.gegc.gosuraksha.features.ratelimit.infra.store;

import uk.gegc.gosuraksha.features.ratelimit.domain.exception.CounterStoreUnavailableException;

/**
 * Atomic operations on the shared counter store. Implementations hold no policy and no
 * process-local state; every method is a single atomic unit on the store.
 *
 * <p>All methods throw {@link CounterStoreUnavailableException} when the store cannot be reached.
 */
public interface CounterStore {

    /**
     * Increments {@code key}, sets {@code ttlSeconds} expiry when the increment created the key,
     * and reports whether the post-increment value is within {@code ceiling}.
     */
    boolean incrementWithinCeiling(String key, long ceiling, long ttlSeconds);

    /**
     * Prunes members scored at or before {@code windowStartMillis}, then adds {@code member} at
     * {@code nowMillis} only if fewer than {@code ceiling} remain, refreshing the key's expiry.
     *
     * @return whether the member was added
     */
    boolean addToWindowIfBelow(String key, long nowMillis, long windowStartMillis, long ceiling,
                               String member, long ttlSeconds);

    /**
     * Sets {@code key} with the given expiry only if it does not exist.
     *
     * @return true only for the caller that created the key
     */
    boolean setIfAbsent(String key, long ttlSeconds);

    boolean exists(String key);
}
