package com.turnstile.common.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * {@link CacheStore} backed by Redis through the shared {@link StringRedisTemplate}.
 * The connection factory behind the template is owned by the Spring container.
 */
@Service
@Slf4j
public class RedisCacheStore implements CacheStore {

    // Lua script: increment only while the counter is below ARGV[1], -1 when full
    private static final String INCREMENT_IF_BELOW_SCRIPT =
        "local current = tonumber(redis.call('GET', KEYS[1]) or '0') " +
        "if current >= tonumber(ARGV[1]) then " +
        "  return -1 " +
        "end " +
        "return redis.call('INCR', KEYS[1])";

    // Lua script: decrement but never below zero
    private static final String DECREMENT_IF_POSITIVE_SCRIPT =
        "local current = tonumber(redis.call('GET', KEYS[1]) or '0') " +
        "if current <= 0 then " +
        "  redis.call('SET', KEYS[1], '0') " +
        "  return 0 " +
        "end " +
        "return redis.call('DECR', KEYS[1])";

    // Lua script: drop the hash and write ARGV as field/value pairs in one step
    private static final String REPLACE_HASH_SCRIPT =
        "redis.call('DEL', KEYS[1]) " +
        "for i = 1, #ARGV, 2 do " +
        "  redis.call('HSET', KEYS[1], ARGV[i], ARGV[i + 1]) " +
        "end " +
        "return #ARGV / 2";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> incrementIfBelowScript;
    private final DefaultRedisScript<Long> decrementIfPositiveScript;
    private final DefaultRedisScript<Long> replaceHashScript;

    @Autowired
    public RedisCacheStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.incrementIfBelowScript = new DefaultRedisScript<>(INCREMENT_IF_BELOW_SCRIPT, Long.class);
        this.decrementIfPositiveScript = new DefaultRedisScript<>(DECREMENT_IF_POSITIVE_SCRIPT, Long.class);
        this.replaceHashScript = new DefaultRedisScript<>(REPLACE_HASH_SCRIPT, Long.class);
    }

    @Override
    public Optional<String> get(String key) {
        return call("retrieving value", key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value) {
        call("setting value", key, () -> {
            redisTemplate.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("setting value", key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("setting value if absent", key,
            () -> Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean exists(String key) {
        return call("checking key", key, () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public Map<String, String> hGetAll(String key) {
        return call("retrieving hashset", key, () -> {
            Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
            Map<String, String> fields = new LinkedHashMap<>();
            entries.forEach((field, value) -> fields.put(String.valueOf(field), String.valueOf(value)));
            return fields;
        });
    }

    @Override
    public void hSet(String key, Map<String, String> fields) {
        call("setting values in hashset", key, () -> {
            redisTemplate.opsForHash().putAll(key, fields);
            return null;
        });
    }

    @Override
    public void hReplace(String key, Map<String, String> fields) {
        Object[] pairs = new Object[fields.size() * 2];
        int i = 0;
        for (Map.Entry<String, String> field : fields.entrySet()) {
            pairs[i++] = field.getKey();
            pairs[i++] = field.getValue();
        }

        call("replacing hashset", key, () -> redisTemplate.execute(
            replaceHashScript, Collections.singletonList(key), pairs));
    }

    @Override
    public void del(String key) {
        call("deleting key", key, () -> redisTemplate.delete(key));
    }

    @Override
    public OptionalLong incrementIfBelow(String key, long limit) {
        Long result = call("incrementing counter", key, () -> redisTemplate.execute(
            incrementIfBelowScript, Collections.singletonList(key), String.valueOf(limit)));

        if (result == null || result < 0) {
            log.debug("Counter {} already at limit {}", key, limit);
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    @Override
    public long decrementIfPositive(String key) {
        Long result = call("decrementing counter", key, () -> redisTemplate.execute(
            decrementIfPositiveScript, Collections.singletonList(key)));
        return result != null ? result : 0L;
    }

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.error("Error checking Redis server status", e);
            return false;
        }
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            log.error("Error {} in Redis: key={}", operation, key, e);
            throw new StoreUnavailableException("Redis unavailable while " + operation + " for key " + key, e);
        }
    }
}
