package com.example.lxmon.queue;

import com.example.lxmon.exception.QueueCacheException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed queue and cache. Commands are LPUSHed and RPOPed, so the list
 * behaves as a FIFO; cache entries are written with SETEX semantics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lxmon.queue", name = "backend", havingValue = "redis")
public class RedisQueueCacheClient implements QueueCacheClient {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void push(long serverId, String payload) {
        String key = QueueCacheClient.queueKey(serverId);
        try {
            redisTemplate.opsForList().leftPush(key, payload);
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to push to " + key, e);
        }
    }

    @Override
    public Optional<String> pop(long serverId) {
        String key = QueueCacheClient.queueKey(serverId);
        try {
            return Optional.ofNullable(redisTemplate.opsForList().rightPop(key));
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to pop from " + key, e);
        }
    }

    @Override
    public long queueLength(long serverId) {
        String key = QueueCacheClient.queueKey(serverId);
        try {
            Long size = redisTemplate.opsForList().size(key);
            return size != null ? size : 0L;
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to read length of " + key, e);
        }
    }

    @Override
    public void setCache(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to set cache key " + key, e);
        }
    }

    @Override
    public Optional<String> getCache(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to get cache key " + key, e);
        }
    }

    @Override
    public boolean deleteCache(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            throw new QueueCacheException("Failed to delete cache key " + key, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
