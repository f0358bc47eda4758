package uk.gegc.gosuraksha.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Refuses to start without an explicit counter store URL. Quota enforcement fails closed, so a
 * missing URL would otherwise surface as every metered request returning 503.
 */
@Slf4j
@Configuration
public class RedisConfig implements InitializingBean {

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    @Override
    public void afterPropertiesSet() {
        String url = redisProperties.getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("spring.data.redis.url must be set");
        }
        if (!url.startsWith("redis://") && !url.startsWith("rediss://")) {
            throw new IllegalStateException("spring.data.redis.url must use the redis:// or rediss:// scheme");
        }
        log.info("Counter store configured (connect timeout {}, command timeout {})",
                redisProperties.getConnectTimeout(), redisProperties.getTimeout());
    }
}
