package uk.gegc.gosuraksha.features.ratelimit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitKeys;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitPrimitives;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitProperties;
import uk.gegc.gosuraksha.features.ratelimit.domain.model.LimitWindow;
import uk.gegc.gosuraksha.features.ratelimit.infra.store.CounterStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitPrimitivesImpl implements RateLimitPrimitives {

    private final CounterStore counterStore;
    private final RateLimitKeys keys;
    private final RateLimitProperties properties;
    private final Clock clock;

    @Override
    public boolean fixedBucketIncrement(String namespace, LimitWindow window, int ceiling, String... subjectParts) {
        if (!window.isCalendarBucket()) {
            throw new IllegalArgumentException("Window " + window + " is not a calendar bucket");
        }
        Instant now = clock.instant();
        String key = keys.build(namespace, append(subjectParts, window.bucket(now)));
        boolean allowed = counterStore.incrementWithinCeiling(key, ceiling, window.secondsUntilBoundary(now));
        log.debug("Fixed bucket {} {} ceiling={} allowed={}", namespace, window.bucket(now), ceiling, allowed);
        return allowed;
    }

    @Override
    public boolean slidingWindowAllow(String namespace, int windowSeconds, int ceiling, String... subjectParts) {
        long nowMillis = clock.millis();
        long windowStart = nowMillis - windowSeconds * 1000L;
        // Millisecond collisions between admits are broken by the random suffix
        String member = nowMillis + ":" + UUID.randomUUID().toString().replace("-", "");
        long ttl = (long) windowSeconds + properties.getSlidingWindowTtlSlackSeconds();
        boolean allowed = counterStore.addToWindowIfBelow(
                keys.build(namespace, subjectParts), nowMillis, windowStart, ceiling, member, ttl);
        log.debug("Sliding window {} window={}s ceiling={} allowed={}", namespace, windowSeconds, ceiling, allowed);
        return allowed;
    }

    @Override
    public boolean acquireCooldown(String namespace, int ttlSeconds, String... subjectParts) {
        return counterStore.setIfAbsent(keys.build(namespace, subjectParts), ttlSeconds);
    }

    @Override
    public boolean isCooldownActive(String namespace, String... subjectParts) {
        return counterStore.exists(keys.build(namespace, subjectParts));
    }

    private static String[] append(String[] parts, String last) {
        String[] all = Arrays.copyOf(parts, parts.length + 1);
        all[parts.length] = last;
        return all;
    }
}
