package uk.gegc.gosuraksha.features.ratelimit.infra.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.ratelimit.domain.exception.CounterStoreUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

@Slf4j
@Component
public class RedisCounterStore implements CounterStore {

    static final RedisScript<Long> FIXED_BUCKET_SCRIPT = new DefaultRedisScript<>("""
            local current = redis.call('INCR', KEYS[1])
            if current == 1 then
                redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            if current <= tonumber(ARGV[2]) then
                return 1
            end
            return 0
            """, Long.class);

    // Prune, count and insert run in one script so two callers cannot both see ceiling - 1
    static final RedisScript<Long> SLIDING_WINDOW_SCRIPT = new DefaultRedisScript<>("""
            redis.call('ZREMRANGEBYSCORE', KEYS[1], 0, ARGV[1])
            local current = redis.call('ZCARD', KEYS[1])
            if current >= tonumber(ARGV[2]) then
                return 0
            end
            redis.call('ZADD', KEYS[1], ARGV[3], ARGV[4])
            redis.call('EXPIRE', KEYS[1], ARGV[5])
            return 1
            """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean incrementWithinCeiling(String key, long ceiling, long ttlSeconds) {
        Long result = execute("fixed_bucket", () -> redisTemplate.execute(
                FIXED_BUCKET_SCRIPT,
                List.of(key),
                String.valueOf(ttlSeconds),
                String.valueOf(ceiling)));
        return result != null && result == 1L;
    }

    @Override
    public boolean addToWindowIfBelow(String key, long nowMillis, long windowStartMillis, long ceiling,
                                      String member, long ttlSeconds) {
        Long result = execute("sliding_window", () -> redisTemplate.execute(
                SLIDING_WINDOW_SCRIPT,
                List.of(key),
                String.valueOf(windowStartMillis),
                String.valueOf(ceiling),
                String.valueOf(nowMillis),
                member,
                String.valueOf(ttlSeconds)));
        return result != null && result == 1L;
    }

    @Override
    public boolean setIfAbsent(String key, long ttlSeconds) {
        Boolean acquired = execute("cooldown_acquire", () -> redisTemplate.opsForValue()
                .setIfAbsent(key, "1", Duration.ofSeconds(ttlSeconds)));
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public boolean exists(String key) {
        Boolean present = execute("cooldown_check", () -> redisTemplate.hasKey(key));
        return Boolean.TRUE.equals(present);
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            log.error("Counter store {} failed: {}", operation, ex.getMessage(), ex);
            throw new CounterStoreUnavailableException(operation, ex);
        }
    }
}
