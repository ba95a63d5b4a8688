package com.cadence.service;

import com.cadence.config.CadenceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-enrollment advisory lock in Redis.
 *
 * HOW IT WORKS:
 *   1. Before advancing, call tryAcquire(enrollmentId)
 *   2. This SETs "cadence:lock:enrollment:{id}" to a fresh token with the NX flag
 *   3. SET succeeded → the caller owns the enrollment and gets the token back
 *   4. SET failed    → another wake-up or sweep is advancing it, skip
 *   5. release(enrollmentId, token) deletes the key only while it still holds
 *      that token, so a pass that outlived the TTL cannot free a newer holder's lock
 *
 * The key expires after cadence.engine.lock-ttl, so a crashed holder never
 * blocks an enrollment for longer than that.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdvancementLockService {

    static final String LOCK_PREFIX = "cadence:lock:enrollment:";

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final CadenceProperties properties;

    public Optional<String> tryAcquire(UUID enrollmentId) {
        String token = UUID.randomUUID().toString();
        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(LOCK_PREFIX + enrollmentId, token, properties.getEngine().getLockTtl());

        if (Boolean.TRUE.equals(wasSet)) {
            return Optional.of(token);
        }
        log.debug("Enrollment {} is being advanced elsewhere, skipping", enrollmentId);
        return Optional.empty();
    }

    public void release(UUID enrollmentId, String token) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_PREFIX + enrollmentId), token);
        if (deleted == null || deleted == 0L) {
            log.warn("Lock on enrollment {} expired before release; it was not deleted", enrollmentId);
        }
    }
}
