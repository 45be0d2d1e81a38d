package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.config.StoreAgentProperties;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-flight guard for one (store, agent) pair, backed by a Redis key with a TTL.
 * <p>
 * The TTL bounds how long a crashed holder can block the pair; the token makes sure only the holder releases it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunLock {

    private static final String KEY_PREFIX = "store-agent:run-lock:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final StoreAgentProperties properties;

    /**
     * @return the owner token, or empty when another run holds the pair
     */
    public Optional<String> tryAcquire(Long storeId, String agentSlug) {
        String token = UUID.randomUUID().toString().replace("-", "");
        Duration ttl = Duration.ofSeconds(properties.getRun().getLockTtlSeconds());
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key(storeId, agentSlug), token, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            return Optional.of(token);
        }
        return Optional.empty();
    }

    public void release(Long storeId, String agentSlug, String token) {
        if (token == null) {
            return;
        }
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key(storeId, agentSlug)), token);
            if (deleted == null || deleted == 0L) {
                log.warn("Run lock already expired or taken over storeId={} agent={}", storeId, agentSlug);
            }
        } catch (Exception e) {
            // the TTL frees the pair eventually
            log.error("Run lock release failed storeId={} agent={}", storeId, agentSlug, e);
        }
    }

    static String key(Long storeId, String agentSlug) {
        return KEY_PREFIX + storeId + ":" + agentSlug;
    }
}
